package org.refactor.semantics.flow;

/**
 * CFG 中两个节点 id 之间的有向边。回边用于闭合循环（循环体出口或 {@code continue} 指回循环头）。
 */
public record CfgEdge(String from, String to, String label, boolean backEdge) {
}
