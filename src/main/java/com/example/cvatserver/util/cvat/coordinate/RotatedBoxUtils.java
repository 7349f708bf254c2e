package com.example.cvatserver.util.cvat.coordinate;

import com.example.cvatserver.util.cvat.dto.BoundingBox;
import com.example.cvatserver.util.cvat.dto.CoordOrigin;

/**
 * 旋转矩形工具类
 *
 * <h3>旋转方向</h3>
 * 正角度表示在渲染后的页面上顺时针旋转（CVAT 约定）：
 * <ul>
 *   <li>TOPLEFT（Y轴向下）：直接使用标准二维旋转矩阵，视觉上即顺时针</li>
 *   <li>BOTTOMLEFT（Y轴向上）：角度取反，保证视觉结果与 TOPLEFT 一致</li>
 * </ul>
 */
public final class RotatedBoxUtils {

    private RotatedBoxUtils() {
    }

    /**
     * 计算矩形绕中心旋转后的最小外接轴对齐矩形
     *
     * <h3>实现原理</h3>
     * <ol>
     *   <li>求中心点与四个角点</li>
     *   <li>每个角点绕中心旋转</li>
     *   <li>取旋转后角点 X/Y 的最小最大值构成新框，坐标系与输入一致</li>
     * </ol>
     *
     * 角度为 360 的整数倍时原样返回输入（无浮点漂移）。
     *
     * @param bbox 原始轴对齐框
     * @param rotationDeg 旋转角度（度），可为任意实数
     * @return 外接轴对齐框
     */
    public static BoundingBox bboxEnclosingRotatedRect(BoundingBox bbox, double rotationDeg) {
        if (!Double.isFinite(rotationDeg) || rotationDeg % 360.0 == 0.0) {
            return bbox;
        }

        double angle = bbox.getCoordOrigin() == CoordOrigin.TOPLEFT ? rotationDeg : -rotationDeg;
        double rad = Math.toRadians(angle);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);

        double cx = (bbox.getL() + bbox.getR()) / 2.0;
        double cy = (bbox.getMinY() + bbox.getMaxY()) / 2.0;

        double[][] corners = {
                {bbox.getL(), bbox.getMinY()},
                {bbox.getR(), bbox.getMinY()},
                {bbox.getR(), bbox.getMaxY()},
                {bbox.getL(), bbox.getMaxY()}
        };

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (double[] corner : corners) {
            double dx = corner[0] - cx;
            double dy = corner[1] - cy;
            double x = cx + dx * cos - dy * sin;
            double y = cy + dx * sin + dy * cos;

            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x);
            minY = Math.min(minY, y);
            maxY = Math.max(maxY, y);
        }

        return BoundingBox.fromExtents(minX, minY, maxX, maxY, bbox.getCoordOrigin());
    }
}
