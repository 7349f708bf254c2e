package com.example.cvatserver.util.cvat;

import com.example.cvatserver.util.cvat.dto.CvatAnnotationPath;
import com.example.cvatserver.util.cvat.dto.CvatElement;
import com.example.cvatserver.util.cvat.dto.PathMappings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 多层级阅读顺序冲突消解
 *
 * 场景：外层路径（level 1）粗略经过了某个容器内部的元素，
 * 而更高层级的路径已在容器内部给出了权威顺序。此时外层路径只应把容器作为一个整体列出。
 *
 * 规则：
 * 1. 对每条 level 1 路径中、同时出现在更高层级路径里的元素 E，
 *    取 E 的"吞并祖先" A：E 的祖先中最靠近根、且子树内不含本路径其它（非嵌套）元素的那个；
 *    已列在本路径中的祖先本身就代表整个子树，直接作为 A
 * 2. A 放在本路径中 A 子树首个成员的位置，A 子树内的其它元素全部移除（A 只出现一次）
 * 3. 找不到 A 时保持外层路径原有顺序，不报错
 * 4. 非 level 1 路径原样保留
 */
public class ReadingOrderConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ReadingOrderConflictResolver.class);

    /**
     * 由元素列表构建包含树后消解冲突
     *
     * @param readingOrder 路径ID -> 有序元素ID
     * @param paths 本页全部路径（用于确定层级）
     * @param elements 本页全部元素
     * @return 新的阅读顺序映射（输入不被修改）
     */
    public static Map<Integer, List<Integer>> resolveReadingOrderConflicts(
            Map<Integer, List<Integer>> readingOrder,
            List<CvatAnnotationPath> paths,
            List<CvatElement> elements) {
        ContainmentTreeBuilder.TreeIndex index =
                ContainmentTreeBuilder.index(ContainmentTreeBuilder.buildContainmentTree(elements));
        return resolveReadingOrderConflicts(readingOrder, paths, index);
    }

    /**
     * 使用已构建的包含树索引消解冲突
     */
    public static Map<Integer, List<Integer>> resolveReadingOrderConflicts(
            Map<Integer, List<Integer>> readingOrder,
            List<CvatAnnotationPath> paths,
            ContainmentTreeBuilder.TreeIndex index) {

        Map<Integer, List<Integer>> result = PathMappings.mutableCopy(readingOrder);

        Map<Integer, Integer> levels = new HashMap<>();
        for (CvatAnnotationPath path : paths) {
            levels.put(path.getId(), path.getLevel());
        }

        // 所有嵌套路径（level > 1）覆盖到的元素
        Set<Integer> nestedIds = new HashSet<>();
        for (Map.Entry<Integer, List<Integer>> entry : result.entrySet()) {
            if (levels.getOrDefault(entry.getKey(), 1) > 1) {
                nestedIds.addAll(entry.getValue());
            }
        }
        if (nestedIds.isEmpty()) {
            return result;
        }

        int subsumed = 0;
        for (Map.Entry<Integer, List<Integer>> entry : result.entrySet()) {
            if (levels.getOrDefault(entry.getKey(), 1) != 1) {
                continue;
            }

            List<Integer> order = entry.getValue();
            Set<Integer> outside = new LinkedHashSet<>();
            for (Integer id : order) {
                if (!nestedIds.contains(id)) {
                    outside.add(id);
                }
            }

            int i = 0;
            while (i < order.size()) {
                int elementId = order.get(i);
                if (!nestedIds.contains(elementId) || !index.contains(elementId)) {
                    i++;
                    continue;
                }

                Integer ancestor = findSubsumingAncestor(elementId, outside, new HashSet<>(order), index);
                if (ancestor == null) {
                    log.debug("路径 {} 中元素 {} 无可吞并的祖先，保留外层顺序", entry.getKey(), elementId);
                    i++;
                    continue;
                }

                Set<Integer> subtree = index.getDescendantIds(ancestor);
                subtree.add(ancestor);

                int firstIndex = i;
                for (int j = 0; j < order.size(); j++) {
                    if (subtree.contains(order.get(j))) {
                        firstIndex = j;
                        break;
                    }
                }

                List<Integer> rebuilt = new ArrayList<>(order.size());
                for (int j = 0; j < order.size(); j++) {
                    if (j == firstIndex) {
                        rebuilt.add(ancestor);
                    } else if (!subtree.contains(order.get(j))) {
                        rebuilt.add(order.get(j));
                    }
                }

                log.debug("路径 {}: 元素 {} 由容器 {} 吞并，位置 {}", entry.getKey(), elementId, ancestor, firstIndex);
                order = rebuilt;
                i = firstIndex + 1;
                subsumed++;
            }

            entry.setValue(order);
        }

        if (subsumed > 0) {
            log.info("阅读顺序冲突消解完成: 吞并 {} 处", subsumed);
        }
        return result;
    }

    /**
     * 由根向下查找第一个已列在路径中、或子树内不含 outside 元素的祖先
     */
    private static Integer findSubsumingAncestor(int elementId, Set<Integer> outside, Set<Integer> listed,
                                                 ContainmentTreeBuilder.TreeIndex index) {
        List<Integer> ancestors = index.getAncestors(elementId);
        for (int k = ancestors.size() - 1; k >= 0; k--) {
            int candidate = ancestors.get(k);
            if (listed.contains(candidate)) {
                return candidate;
            }
            boolean clean = true;
            for (Integer other : outside) {
                if (index.isAncestor(candidate, other)) {
                    clean = false;
                    break;
                }
            }
            if (clean) {
                return candidate;
            }
        }
        return null;
    }
}
