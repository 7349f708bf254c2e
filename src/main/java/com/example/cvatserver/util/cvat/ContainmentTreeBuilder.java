package com.example.cvatserver.util.cvat;

import com.example.cvatserver.util.cvat.dto.BoundingBox;
import com.example.cvatserver.util.cvat.dto.CvatElement;
import com.example.cvatserver.util.cvat.dto.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 包含树构建器
 *
 * 功能：
 * - 按边界框包含关系把页面元素组织成森林
 * - 每个元素挂到包含它的最小元素下（最紧父节点）
 * - 同级节点按空间顺序排列：先上后下，再从左到右，最后按ID
 *
 * 包含判定：
 * 1. 子框与父框的相交面积 / 子框面积 >= 阈值（默认 0.95），吸收标注抖动
 * 2. 子框面积为0时，退化为"子框落在父框扩展 tolerance 后的范围内"
 * 3. 父框必须严格"更大"：面积更大，或面积相同且ID更小。保证不会自包含、不会成环
 */
public class ContainmentTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContainmentTreeBuilder.class);

    /** 默认包含比例阈值 */
    public static final double DEFAULT_CONTAINMENT_THRESHOLD = 0.95;

    /** 零面积元素的包含容差（页面坐标单位） */
    private static final double DEGENERATE_TOLERANCE = 1.0;

    /**
     * 同级空间顺序：上边 -> 左边 -> ID
     */
    public static final Comparator<TreeNode> SPATIAL_ORDER = Comparator
            .comparingDouble((TreeNode n) -> n.getElement().getBbox().getReadingTop())
            .thenComparingDouble(n -> n.getElement().getBbox().getL())
            .thenComparingInt(TreeNode::getId);

    /**
     * 使用默认阈值构建包含森林
     */
    public static List<TreeNode> buildContainmentTree(List<CvatElement> elements) {
        return buildContainmentTree(elements, DEFAULT_CONTAINMENT_THRESHOLD);
    }

    /**
     * 构建包含森林
     *
     * @param elements 页面元素
     * @param threshold 包含比例阈值（0~1）
     * @return 按空间顺序排列的根节点列表
     */
    public static List<TreeNode> buildContainmentTree(List<CvatElement> elements, double threshold) {
        if (elements == null || elements.isEmpty()) {
            return new ArrayList<>();
        }

        Map<Integer, TreeNode> nodes = new LinkedHashMap<>();
        for (CvatElement element : elements) {
            nodes.put(element.getId(), new TreeNode(element));
        }

        List<TreeNode> roots = new ArrayList<>();
        for (CvatElement child : elements) {
            CvatElement parent = findTightestParent(child, elements, threshold);
            TreeNode childNode = nodes.get(child.getId());
            if (parent == null) {
                roots.add(childNode);
            } else {
                nodes.get(parent.getId()).addChild(childNode);
                log.debug("元素 {} 挂载到 {}", child.getId(), parent.getId());
            }
        }

        for (TreeNode node : nodes.values()) {
            node.sortChildren(SPATIAL_ORDER);
        }
        roots.sort(SPATIAL_ORDER);

        log.debug("包含树构建完成: 元素={}, 根节点={}", elements.size(), roots.size());
        return roots;
    }

    /**
     * 查找包含 child 的最紧父元素（面积最小，面积相同取ID最小）
     */
    private static CvatElement findTightestParent(CvatElement child, List<CvatElement> candidates, double threshold) {
        CvatElement best = null;
        for (CvatElement candidate : candidates) {
            if (candidate.getId() == child.getId()) {
                continue;
            }
            if (!ranksAbove(candidate, child) || !contains(candidate.getBbox(), child.getBbox(), threshold)) {
                continue;
            }
            if (best == null
                    || candidate.getBbox().getArea() < best.getBbox().getArea()
                    || (candidate.getBbox().getArea() == best.getBbox().getArea() && candidate.getId() < best.getId())) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * 父框是否严格"更大"
     */
    static boolean ranksAbove(CvatElement parent, CvatElement child) {
        double parentArea = parent.getBbox().getArea();
        double childArea = child.getBbox().getArea();
        if (parentArea != childArea) {
            return parentArea > childArea;
        }
        return parent.getId() < child.getId();
    }

    /**
     * 包含判定（见类注释）
     */
    static boolean contains(BoundingBox outer, BoundingBox inner, double threshold) {
        if (inner.getArea() <= 0) {
            return outer.containsBox(inner, DEGENERATE_TOLERANCE);
        }
        return inner.intersectionOverSelf(outer) >= threshold;
    }

    /**
     * 为森林建立索引
     */
    public static TreeIndex index(List<TreeNode> roots) {
        return new TreeIndex(roots);
    }

    /**
     * 包含森林的只读索引：ID -> 节点、ID -> 父ID、空间先序序列
     *
     * 每次解析调用时构建，用完即弃。
     */
    public static class TreeIndex {
        private final List<TreeNode> roots;
        private final Map<Integer, TreeNode> nodes = new LinkedHashMap<>();
        private final Map<Integer, Integer> parents = new HashMap<>();
        private final List<TreeNode> spatialPreorder = new ArrayList<>();

        TreeIndex(List<TreeNode> roots) {
            this.roots = sortedCopy(roots);

            // 迭代式先序遍历，子节点按空间顺序
            Deque<TreeNode> stack = new ArrayDeque<>();
            for (int i = this.roots.size() - 1; i >= 0; i--) {
                stack.push(this.roots.get(i));
            }
            while (!stack.isEmpty()) {
                TreeNode node = stack.pop();
                if (nodes.containsKey(node.getId())) {
                    log.warn("包含树中元素 {} 出现多次，忽略重复节点", node.getId());
                    continue;
                }
                nodes.put(node.getId(), node);
                spatialPreorder.add(node);

                List<TreeNode> children = sortedCopy(node.getChildren());
                for (int i = children.size() - 1; i >= 0; i--) {
                    TreeNode child = children.get(i);
                    parents.putIfAbsent(child.getId(), node.getId());
                    stack.push(child);
                }
            }
        }

        private static List<TreeNode> sortedCopy(List<TreeNode> list) {
            List<TreeNode> copy = new ArrayList<>(list);
            copy.sort(SPATIAL_ORDER);
            return copy;
        }

        public List<TreeNode> getRoots() {
            return Collections.unmodifiableList(roots);
        }

        public boolean contains(int id) {
            return nodes.containsKey(id);
        }

        public TreeNode getNode(int id) {
            return nodes.get(id);
        }

        /**
         * @return 父元素ID，根节点返回 null
         */
        public Integer getParentId(int id) {
            return parents.get(id);
        }

        /**
         * @return 祖先ID列表，由近及远
         */
        public List<Integer> getAncestors(int id) {
            List<Integer> ancestors = new ArrayList<>();
            Integer current = parents.get(id);
            while (current != null) {
                ancestors.add(current);
                current = parents.get(current);
            }
            return ancestors;
        }

        /**
         * ancestorId 是否为 id 的（严格）祖先
         */
        public boolean isAncestor(int ancestorId, int id) {
            Integer current = parents.get(id);
            while (current != null) {
                if (current == ancestorId) {
                    return true;
                }
                current = parents.get(current);
            }
            return false;
        }

        /**
         * @return 子孙ID集合（先序，不含自身）
         */
        public Set<Integer> getDescendantIds(int id) {
            Set<Integer> result = new LinkedHashSet<>();
            TreeNode node = nodes.get(id);
            if (node == null) {
                return result;
            }
            Deque<TreeNode> stack = new ArrayDeque<>(sortedCopy(node.getChildren()));
            while (!stack.isEmpty()) {
                TreeNode current = stack.pollFirst();
                if (result.add(current.getId())) {
                    List<TreeNode> children = sortedCopy(current.getChildren());
                    for (int i = children.size() - 1; i >= 0; i--) {
                        stack.addFirst(children.get(i));
                    }
                }
            }
            return result;
        }

        /**
         * @return 空间先序节点序列
         */
        public List<TreeNode> getSpatialPreorder() {
            return Collections.unmodifiableList(spatialPreorder);
        }

        /**
         * @return 同级兄弟（含自身），按空间顺序
         */
        public List<TreeNode> getSiblings(int id) {
            Integer parentId = parents.get(id);
            if (parentId == null) {
                return Collections.unmodifiableList(roots);
            }
            return sortedCopy(nodes.get(parentId).getChildren());
        }

        /**
         * 最低公共祖先（可为列表中的某个元素本身）
         *
         * @return 公共祖先ID；无公共祖先或列表为空时返回 null
         */
        public Integer lowestCommonAncestor(List<Integer> ids) {
            Integer lca = null;
            boolean first = true;
            for (Integer id : ids) {
                if (!nodes.containsKey(id)) {
                    continue;
                }
                if (first) {
                    lca = id;
                    first = false;
                    continue;
                }
                while (lca != null && !lca.equals(id) && !isAncestor(lca, id)) {
                    lca = parents.get(lca);
                }
                if (lca == null) {
                    return null;
                }
            }
            return lca;
        }
    }
}
