package com.example.cvatserver.util.cvat;

import com.example.cvatserver.util.cvat.dto.BoundingBox;
import com.example.cvatserver.util.cvat.dto.CvatAnnotationPath;
import com.example.cvatserver.util.cvat.dto.CvatElement;
import com.example.cvatserver.util.cvat.dto.PathMappings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 路径点 -> 元素映射
 *
 * 功能：
 * - 每个路径点命中包含它的最小元素（框扩展 tolerance 后判定）
 * - 按路径标签分流到 readingOrder / merge / group / toCaption / toFootnote / toValue
 * - 为嵌套阅读顺序路径（level > 1）推断容器元素
 */
public class PathElementMapper {

    private static final Logger log = LoggerFactory.getLogger(PathElementMapper.class);

    /**
     * 把所有路径映射到元素序列
     *
     * @param paths 本页路径
     * @param elements 本页元素
     * @param tolerance 点命中容差（页面坐标单位）
     * @return 路径映射
     */
    public static PathMappings mapPathPointsToElements(List<CvatAnnotationPath> paths,
                                                       List<CvatElement> elements,
                                                       double tolerance) {
        Map<Integer, List<Integer>> readingOrder = new LinkedHashMap<>();
        Map<Integer, List<Integer>> merge = new LinkedHashMap<>();
        Map<Integer, List<Integer>> group = new LinkedHashMap<>();
        Map<Integer, List<Integer>> toCaption = new LinkedHashMap<>();
        Map<Integer, List<Integer>> toFootnote = new LinkedHashMap<>();
        Map<Integer, List<Integer>> toValue = new LinkedHashMap<>();

        for (CvatAnnotationPath path : paths) {
            Map<Integer, List<Integer>> target;
            switch (path.getLabel()) {
                case CvatAnnotationPath.READING_ORDER:
                    target = readingOrder;
                    break;
                case CvatAnnotationPath.MERGE:
                    target = merge;
                    break;
                case CvatAnnotationPath.GROUP:
                    target = group;
                    break;
                case CvatAnnotationPath.TO_CAPTION:
                    target = toCaption;
                    break;
                case CvatAnnotationPath.TO_FOOTNOTE:
                    target = toFootnote;
                    break;
                case CvatAnnotationPath.TO_VALUE:
                    target = toValue;
                    break;
                default:
                    log.debug("路径 {} 标签 '{}' 无对应映射，忽略", path.getId(), path.getLabel());
                    continue;
            }

            List<Integer> touched = mapPath(path, elements, tolerance);
            if (touched.isEmpty()) {
                log.warn("路径 {} ({}) 未命中任何元素", path.getId(), path.getLabel());
            }
            target.put(path.getId(), touched);
        }

        return new PathMappings(readingOrder, merge, group, toCaption, toFootnote, toValue);
    }

    /**
     * 单条路径依次命中的元素（重复命中只保留第一次）
     */
    static List<Integer> mapPath(CvatAnnotationPath path, List<CvatElement> elements, double tolerance) {
        Set<Integer> touched = new LinkedHashSet<>();
        for (double[] point : path.getPoints()) {
            CvatElement hit = findDeepestElementAt(point[0], point[1], elements, tolerance);
            if (hit != null) {
                touched.add(hit.getId());
            }
        }
        return new ArrayList<>(touched);
    }

    /**
     * 包含该点的最小元素；面积相同时取ID较小者
     */
    static CvatElement findDeepestElementAt(double x, double y, List<CvatElement> elements, double tolerance) {
        CvatElement best = null;
        for (CvatElement element : elements) {
            BoundingBox box = element.getBbox();
            if (!box.containsPoint(x, y, tolerance)) {
                continue;
            }
            if (best == null
                    || box.getArea() < best.getBbox().getArea()
                    || (box.getArea() == best.getBbox().getArea() && element.getId() < best.getId())) {
                best = element;
            }
        }
        return best;
    }

    /**
     * 为嵌套阅读顺序路径推断容器：包含路径全部点、且不属于该路径自身元素的最小元素
     *
     * @param paths 本页路径
     * @param mappings 已完成的路径映射
     * @param elements 本页元素
     * @param tolerance 容差
     * @return 路径ID -> 容器元素ID
     */
    public static Map<Integer, Integer> mapPathsToContainers(List<CvatAnnotationPath> paths,
                                                             PathMappings mappings,
                                                             List<CvatElement> elements,
                                                             double tolerance) {
        Map<Integer, Integer> containers = new LinkedHashMap<>();
        for (CvatAnnotationPath path : paths) {
            if (!path.isReadingOrder() || path.getLevel() <= 1) {
                continue;
            }
            List<Integer> own = mappings.getReadingOrder().get(path.getId());
            CvatElement best = null;
            for (CvatElement element : elements) {
                if (own != null && own.contains(element.getId())) {
                    continue;
                }
                if (!TableBoundaryPromoter.isPathInside(path, element.getBbox(), tolerance)) {
                    continue;
                }
                if (best == null
                        || element.getBbox().getArea() < best.getBbox().getArea()
                        || (element.getBbox().getArea() == best.getBbox().getArea() && element.getId() < best.getId())) {
                    best = element;
                }
            }
            if (best != null) {
                containers.put(path.getId(), best.getId());
                log.debug("嵌套路径 {} 的容器为元素 {}", path.getId(), best.getId());
            }
        }
        return containers;
    }
}
