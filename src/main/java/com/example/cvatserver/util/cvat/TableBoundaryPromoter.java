package com.example.cvatserver.util.cvat;

import com.example.cvatserver.util.cvat.dto.BoundingBox;
import com.example.cvatserver.util.cvat.dto.CvatAnnotationPath;
import com.example.cvatserver.util.cvat.dto.PathMappings;
import com.example.cvatserver.util.cvat.dto.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表格跨边界提升
 *
 * 阅读顺序路径从表格外部穿入表格、只串到了表格内的单元格，表格本身却没出现在路径列表里。
 * 这种情况下需要在路径进入表格处登记表格：把表格ID插入到该路径列表中第一个表格子孙之前。
 *
 * 判定：
 * - 路径所有点都落在表格框（扩展 tolerance）内：视为内部路径，不处理
 * - 否则视为跨边界，插入表格；表格已在列表中时不重复插入
 */
public class TableBoundaryPromoter {

    private static final Logger log = LoggerFactory.getLogger(TableBoundaryPromoter.class);

    /**
     * 执行跨边界提升
     *
     * @param mappings 当前路径映射
     * @param paths 本页全部路径
     * @param treeRoots 包含森林
     * @param tolerance 边界容差（页面坐标单位），端点距边界在此范围内视为在内部
     * @return 新的路径映射（仅 readingOrder 可能变化）
     */
    public static PathMappings promoteTableCrossBoundaryReadingOrder(
            PathMappings mappings,
            List<CvatAnnotationPath> paths,
            List<TreeNode> treeRoots,
            double tolerance) {

        ContainmentTreeBuilder.TreeIndex index = ContainmentTreeBuilder.index(treeRoots);
        Map<Integer, List<Integer>> readingOrder = PathMappings.mutableCopy(mappings.getReadingOrder());

        int promoted = 0;
        for (TreeNode node : index.getSpatialPreorder()) {
            if (!node.getElement().getLabel().isTableLike()) {
                continue;
            }
            int tableId = node.getId();
            BoundingBox tableBox = node.getElement().getBbox();
            Set<Integer> descendants = index.getDescendantIds(tableId);
            if (descendants.isEmpty()) {
                continue;
            }

            for (CvatAnnotationPath path : paths) {
                List<Integer> order = readingOrder.get(path.getId());
                if (order == null || order.contains(tableId)) {
                    continue;
                }

                int firstDescendant = -1;
                for (int i = 0; i < order.size(); i++) {
                    if (descendants.contains(order.get(i))) {
                        firstDescendant = i;
                        break;
                    }
                }
                if (firstDescendant < 0) {
                    continue;
                }

                if (isPathInside(path, tableBox, tolerance)) {
                    continue;
                }

                order.add(firstDescendant, tableId);
                promoted++;
                log.debug("路径 {} 穿越表格 {} 边界，插入位置 {}", path.getId(), tableId, firstDescendant);
            }
        }

        if (promoted > 0) {
            log.info("表格跨边界提升: 插入 {} 处", promoted);
        }
        return mappings.withReadingOrder(readingOrder);
    }

    /**
     * 路径所有点是否都在框内（框向外扩展 tolerance）
     */
    static boolean isPathInside(CvatAnnotationPath path, BoundingBox box, double tolerance) {
        for (double[] point : path.getPoints()) {
            if (!box.containsPoint(point[0], point[1], tolerance)) {
                return false;
            }
        }
        return true;
    }
}
