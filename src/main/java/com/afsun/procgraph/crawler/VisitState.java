package com.afsun.procgraph.crawler;

/**
 * 单次爬取中过程节点的访问状态，只能按 UNVISITED → ON_PATH → DONE 前进
 *
 * @author afsun
 */
public enum VisitState {
    UNVISITED,
    ON_PATH,
    DONE
}
