package com.example.cvatserver.util.cvat;

import com.example.cvatserver.util.cvat.dto.CvatAnnotationPath;
import com.example.cvatserver.util.cvat.dto.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 全局阅读顺序组装
 *
 * 输入各路径的有序元素列表与包含森林，输出覆盖森林中所有元素的唯一线性顺序。
 *
 * 处理顺序：
 * 1. level 1 路径（按输入顺序）：依次追加路径元素。从 A 走到 B 时：
 *    - A 的祖先中不含 B、未出现在任何路径中且尚未放置的，紧跟在 A 之后输出（由内向外，"闭括号"）
 *    - B 的祖先中不含 A、未出现在任何路径中且尚未放置的，紧贴在 B 之前输出（由外向内，"开括号"）
 *    路径第一个元素不输出开括号；路径结束时对最后一个元素补齐闭括号
 * 2. 嵌套路径（level > 1，按 level 升序）：在其容器内部给出权威顺序
 *    - 已被外层放置的元素先摘出
 *    - 容器已放置：整段插在容器区块之后
 *    - 容器未放置但有被摘出的元素：容器连同整段插回第一个被摘出的位置
 *    - 其它情况挂起，等容器放置后紧随其后插入（容器因此紧贴在该段之前）
 * 3. 剩余元素按空间先序兜底：插在最近的前一个兄弟区块之后，没有则紧跟父节点，根节点则放在最前
 *
 * 不在包含森林中的ID被忽略；每个ID只出现一次。
 */
public class GlobalReadingOrderBuilder {

    private static final Logger log = LoggerFactory.getLogger(GlobalReadingOrderBuilder.class);

    /**
     * 组装全局阅读顺序
     *
     * @param paths 本页全部路径
     * @param pathToElements 路径ID -> 有序元素ID
     * @param pathToContainer 路径ID -> 限定该路径的容器元素ID（可为空映射）
     * @param treeRoots 包含森林
     * @return 全局有序元素ID列表
     */
    public static List<Integer> buildGlobalReadingOrder(
            List<CvatAnnotationPath> paths,
            Map<Integer, List<Integer>> pathToElements,
            Map<Integer, Integer> pathToContainer,
            List<TreeNode> treeRoots) {

        Assembly assembly = new Assembly(ContainmentTreeBuilder.index(treeRoots),
                pathToContainer != null ? pathToContainer : Collections.emptyMap());

        List<PathEntry> entries = collectEntries(paths, pathToElements);
        for (PathEntry entry : entries) {
            assembly.markPathed(entry.elementIds);
        }

        for (PathEntry entry : entries) {
            if (entry.level <= 1) {
                assembly.placeOuterPath(entry);
            }
        }
        for (PathEntry entry : entries) {
            if (entry.level > 1) {
                assembly.placeNestedPath(entry);
            }
        }
        assembly.placeRemaining();

        log.debug("全局阅读顺序: 路径={}, 元素={}", entries.size(), assembly.order.size());
        return new ArrayList<>(assembly.order);
    }

    /**
     * 按 (level, 输入顺序) 排列路径；映射中有但路径列表中没有的路径视为 level 1，排在最后
     */
    private static List<PathEntry> collectEntries(List<CvatAnnotationPath> paths,
                                                  Map<Integer, List<Integer>> pathToElements) {
        List<PathEntry> entries = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        int sequence = 0;
        if (paths != null) {
            for (CvatAnnotationPath path : paths) {
                List<Integer> ids = pathToElements.get(path.getId());
                if (ids != null && seen.add(path.getId())) {
                    entries.add(new PathEntry(path.getId(), path.getLevel(), sequence++, ids));
                }
            }
        }
        for (Map.Entry<Integer, List<Integer>> mapping : pathToElements.entrySet()) {
            if (seen.add(mapping.getKey())) {
                entries.add(new PathEntry(mapping.getKey(), 1, sequence++, mapping.getValue()));
            }
        }
        entries.sort(Comparator.comparingInt((PathEntry e) -> e.level).thenComparingInt(e -> e.sequence));
        return entries;
    }

    /**
     * 路径条目
     */
    private static class PathEntry {
        final int pathId;
        final int level;
        final int sequence;
        final List<Integer> elementIds;

        PathEntry(int pathId, int level, int sequence, List<Integer> elementIds) {
            this.pathId = pathId;
            this.level = level;
            this.sequence = sequence;
            this.elementIds = elementIds;
        }
    }

    /**
     * 单次组装的状态
     */
    private static class Assembly {
        final ContainmentTreeBuilder.TreeIndex index;
        final Map<Integer, Integer> pathToContainer;
        final List<Integer> order = new ArrayList<>();
        final Set<Integer> placed = new HashSet<>();
        final Set<Integer> pathed = new HashSet<>();
        /** 容器ID -> 等待容器放置后插入的元素 */
        final Map<Integer, List<Integer>> pending = new LinkedHashMap<>();

        Assembly(ContainmentTreeBuilder.TreeIndex index, Map<Integer, Integer> pathToContainer) {
            this.index = index;
            this.pathToContainer = pathToContainer;
        }

        void markPathed(List<Integer> ids) {
            for (Integer id : ids) {
                if (index.contains(id)) {
                    pathed.add(id);
                }
            }
        }

        // ========== 步骤1：外层路径 ==========

        void placeOuterPath(PathEntry entry) {
            List<Integer> sequence = new ArrayList<>();
            for (Integer id : distinctKnown(entry)) {
                if (!placed.contains(id)) {
                    sequence.add(id);
                }
            }
            if (sequence.isEmpty()) {
                return;
            }
            insertAt(order.size(), withBrackets(sequence, null));
        }

        // ========== 步骤2：嵌套路径 ==========

        void placeNestedPath(PathEntry entry) {
            List<Integer> sequence = new ArrayList<>(distinctKnown(entry));
            if (sequence.isEmpty()) {
                return;
            }

            Integer container = resolveContainer(entry.pathId, sequence);

            // 摘出已被外层放置的元素，记录第一个位置
            int anchor = -1;
            for (int i = 0; i < order.size(); i++) {
                if (sequence.contains(order.get(i))) {
                    anchor = i;
                    break;
                }
            }
            if (anchor >= 0) {
                order.removeIf(sequence::contains);
                placed.removeAll(sequence);
            }

            List<Integer> block = withBrackets(sequence, container);

            if (container != null && placed.contains(container)) {
                insertAt(blockEnd(container) + 1, block);
            } else if (anchor >= 0) {
                if (container != null) {
                    block.add(0, container);
                }
                insertAt(anchor, block);
            } else if (container == null) {
                insertAt(order.size(), block);
            } else {
                pending.computeIfAbsent(container, k -> new ArrayList<>()).addAll(block);
                log.debug("路径 {} 等待容器 {} 放置", entry.pathId, container);
            }
        }

        /**
         * 显式容器优先；否则取路径元素的最低公共祖先（若恰为路径元素之一，则取其父节点）
         */
        private Integer resolveContainer(int pathId, List<Integer> sequence) {
            Integer container = pathToContainer.get(pathId);
            if (container != null && index.contains(container) && !sequence.contains(container)) {
                return container;
            }
            Integer lca = index.lowestCommonAncestor(sequence);
            if (lca != null && sequence.contains(lca)) {
                lca = index.getParentId(lca);
            }
            return lca;
        }

        // ========== 步骤3：空间兜底 ==========

        void placeRemaining() {
            for (TreeNode node : index.getSpatialPreorder()) {
                int id = node.getId();
                if (placed.contains(id)) {
                    continue;
                }
                insertAt(fallbackPosition(id), Collections.singletonList(id));
            }

            // 正常情况下挂起项已随容器放置全部插入
            for (List<Integer> waiting : new ArrayList<>(pending.values())) {
                insertAt(order.size(), waiting);
            }
            pending.clear();
        }

        private int fallbackPosition(int id) {
            List<TreeNode> siblings = index.getSiblings(id);
            Integer previous = null;
            for (TreeNode sibling : siblings) {
                if (sibling.getId() == id) {
                    break;
                }
                if (blockEnd(sibling.getId()) >= 0) {
                    previous = sibling.getId();
                }
            }
            if (previous != null) {
                return blockEnd(previous) + 1;
            }
            Integer parentId = index.getParentId(id);
            if (parentId != null && placed.contains(parentId)) {
                return order.indexOf(parentId) + 1;
            }
            return 0;
        }

        // ========== 公共 ==========

        /**
         * 为路径序列补上祖先"括号"；只考虑 container 以下（不含 container）的祖先
         */
        private List<Integer> withBrackets(List<Integer> sequence, Integer container) {
            List<Integer> block = new ArrayList<>();
            Set<Integer> inBlock = new HashSet<>();
            Integer previous = null;
            for (Integer id : sequence) {
                if (previous != null) {
                    closeAncestors(previous, id, container, block, inBlock);
                    openAncestors(id, previous, container, block, inBlock);
                }
                if (inBlock.add(id)) {
                    block.add(id);
                }
                previous = id;
            }
            if (previous != null) {
                closeAncestors(previous, null, container, block, inBlock);
            }
            return block;
        }

        private void closeAncestors(int from, Integer next, Integer container,
                                    List<Integer> block, Set<Integer> inBlock) {
            for (Integer ancestor : index.getAncestors(from)) {
                if (ancestor.equals(container)) {
                    break;
                }
                if (next != null && (ancestor.equals(next) || index.isAncestor(ancestor, next))) {
                    break;
                }
                if (pathed.contains(ancestor) && !placed.contains(ancestor) && !inBlock.contains(ancestor)) {
                    break;
                }
                if (isBracketCandidate(ancestor, inBlock)) {
                    block.add(ancestor);
                    inBlock.add(ancestor);
                }
            }
        }

        private void openAncestors(int to, int previous, Integer container,
                                   List<Integer> block, Set<Integer> inBlock) {
            List<Integer> opening = new ArrayList<>();
            for (Integer ancestor : index.getAncestors(to)) {
                if (ancestor.equals(container)) {
                    break;
                }
                if (ancestor == previous || index.isAncestor(ancestor, previous)) {
                    break;
                }
                opening.add(ancestor);
            }
            Collections.reverse(opening);
            for (Integer ancestor : opening) {
                if (isBracketCandidate(ancestor, inBlock)) {
                    block.add(ancestor);
                    inBlock.add(ancestor);
                }
            }
        }

        private boolean isBracketCandidate(int id, Set<Integer> inBlock) {
            return !pathed.contains(id) && !placed.contains(id) && !inBlock.contains(id);
        }

        /**
         * 逐个插入，每插入一个元素就把挂在它名下的等待项紧随其后插入
         *
         * @return 下一个插入位置
         */
        private int insertAt(int position, List<Integer> ids) {
            int cursor = position;
            for (Integer id : ids) {
                if (placed.contains(id)) {
                    continue;
                }
                order.add(cursor++, id);
                placed.add(id);
                List<Integer> waiting = pending.remove(id);
                if (waiting != null) {
                    cursor = insertAt(cursor, waiting);
                }
            }
            return cursor;
        }

        /**
         * 元素自身及其已放置子孙在 order 中的最大下标；都未放置时返回 -1
         */
        private int blockEnd(int id) {
            Set<Integer> members = index.getDescendantIds(id);
            members.add(id);
            int end = -1;
            for (int i = 0; i < order.size(); i++) {
                if (members.contains(order.get(i))) {
                    end = i;
                }
            }
            return end;
        }

        private Set<Integer> distinctKnown(PathEntry entry) {
            Set<Integer> ids = new LinkedHashSet<>();
            for (Integer id : entry.elementIds) {
                if (index.contains(id)) {
                    ids.add(id);
                } else {
                    log.debug("路径 {} 中的元素 {} 不在包含树中，忽略", entry.pathId, id);
                }
            }
            return ids;
        }
    }
}
