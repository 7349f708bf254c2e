package com.example.cvatserver.util.cvat.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 包含树节点
 *
 * 节点只持有子节点（由父节点独占），不保存父指针；
 * 需要向上查找时由 ContainmentTreeBuilder 按需建立索引。
 */
public class TreeNode {
    private final CvatElement element;
    private final List<TreeNode> children = new ArrayList<>();

    public TreeNode(CvatElement element) {
        this.element = element;
    }

    public CvatElement getElement() {
        return element;
    }

    public int getId() {
        return element.getId();
    }

    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * 挂载子节点（仅在建树阶段调用）
     */
    public void addChild(TreeNode child) {
        children.add(child);
    }

    /**
     * 按给定顺序重排子节点（仅在建树阶段调用）
     */
    public void sortChildren(Comparator<TreeNode> comparator) {
        children.sort(comparator);
    }

    @Override
    public String toString() {
        return "TreeNode{id=" + element.getId() + ", label=" + element.getLabel() + ", children=" + children.size() + "}";
    }
}
