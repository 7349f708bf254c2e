package com.example.cvatserver.util.cvat.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 轴对齐边界框（不可变）
 *
 * <h3>坐标约定</h3>
 * <ul>
 *   <li>l/r：左右边界，始终 l &lt;= r</li>
 *   <li>t/b：上下边界，含义取决于 {@link CoordOrigin}
 *     <ul>
 *       <li>TOPLEFT：t 为较小的Y（上边），b 为较大的Y</li>
 *       <li>BOTTOMLEFT：t 为较大的Y（上边），b 为较小的Y</li>
 *     </ul>
 *   </li>
 * </ul>
 *
 * 两个框之间的运算（包含、相交）要求二者处于同一坐标系。
 */
@JsonPropertyOrder({"l", "t", "r", "b", "coord_origin"})
public final class BoundingBox {

    private final double l;
    private final double t;
    private final double r;
    private final double b;
    private final CoordOrigin coordOrigin;

    public BoundingBox(double l, double t, double r, double b, CoordOrigin coordOrigin) {
        this.l = l;
        this.t = t;
        this.r = r;
        this.b = b;
        this.coordOrigin = Objects.requireNonNull(coordOrigin, "coordOrigin");
    }

    /**
     * 左上角原点的便捷构造
     */
    public static BoundingBox topLeft(double l, double t, double r, double b) {
        return new BoundingBox(l, t, r, b, CoordOrigin.TOPLEFT);
    }

    /**
     * 由Y范围构造，按坐标系决定 t/b 的取值
     */
    public static BoundingBox fromExtents(double minX, double minY, double maxX, double maxY, CoordOrigin origin) {
        if (origin == CoordOrigin.TOPLEFT) {
            return new BoundingBox(minX, minY, maxX, maxY, origin);
        }
        return new BoundingBox(minX, maxY, maxX, minY, origin);
    }

    @JsonProperty("l")
    public double getL() {
        return l;
    }

    @JsonProperty("t")
    public double getT() {
        return t;
    }

    @JsonProperty("r")
    public double getR() {
        return r;
    }

    @JsonProperty("b")
    public double getB() {
        return b;
    }

    @JsonProperty("coord_origin")
    public CoordOrigin getCoordOrigin() {
        return coordOrigin;
    }

    // ========== 几何量 ==========

    @JsonIgnore
    public double getWidth() {
        return r - l;
    }

    @JsonIgnore
    public double getHeight() {
        return Math.abs(b - t);
    }

    @JsonIgnore
    public double getArea() {
        return Math.max(0.0, getWidth()) * getHeight();
    }

    /** 较小的Y（与坐标系无关） */
    @JsonIgnore
    public double getMinY() {
        return Math.min(t, b);
    }

    /** 较大的Y（与坐标系无关） */
    @JsonIgnore
    public double getMaxY() {
        return Math.max(t, b);
    }

    @JsonIgnore
    public double getCenterX() {
        return (l + r) / 2.0;
    }

    @JsonIgnore
    public double getCenterY() {
        return (t + b) / 2.0;
    }

    /**
     * 页面阅读意义上的上边距离（越小越靠上）
     *
     * TOPLEFT 下即 t；BOTTOMLEFT 下取 -t，使排序方向一致。
     */
    @JsonIgnore
    public double getReadingTop() {
        return coordOrigin == CoordOrigin.TOPLEFT ? t : -t;
    }

    // ========== 运算 ==========

    /**
     * 点是否落在框内（边界视为在内）
     */
    public boolean containsPoint(double x, double y, double tolerance) {
        return x >= l - tolerance && x <= r + tolerance
                && y >= getMinY() - tolerance && y <= getMaxY() + tolerance;
    }

    /**
     * other 是否完全落在本框内
     */
    public boolean containsBox(BoundingBox other, double tolerance) {
        return other.l >= l - tolerance && other.r <= r + tolerance
                && other.getMinY() >= getMinY() - tolerance && other.getMaxY() <= getMaxY() + tolerance;
    }

    /**
     * 相交面积（不相交为0）
     */
    public double intersectionArea(BoundingBox other) {
        double w = Math.min(r, other.r) - Math.max(l, other.l);
        double h = Math.min(getMaxY(), other.getMaxY()) - Math.max(getMinY(), other.getMinY());
        if (w <= 0 || h <= 0) {
            return 0.0;
        }
        return w * h;
    }

    /**
     * 相交面积占本框面积的比例；本框面积为0时返回0
     */
    public double intersectionOverSelf(BoundingBox other) {
        double area = getArea();
        if (area <= 0) {
            return 0.0;
        }
        return intersectionArea(other) / area;
    }

    /**
     * 转换到左上角原点
     *
     * @param pageHeight 页面高度
     */
    public BoundingBox toTopLeftOrigin(double pageHeight) {
        if (coordOrigin == CoordOrigin.TOPLEFT) {
            return this;
        }
        return new BoundingBox(l, pageHeight - t, r, pageHeight - b, CoordOrigin.TOPLEFT);
    }

    /**
     * 转换到左下角原点（PDF用户空间）
     *
     * @param pageHeight 页面高度
     */
    public BoundingBox toBottomLeftOrigin(double pageHeight) {
        if (coordOrigin == CoordOrigin.BOTTOMLEFT) {
            return this;
        }
        return new BoundingBox(l, pageHeight - t, r, pageHeight - b, CoordOrigin.BOTTOMLEFT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundingBox)) {
            return false;
        }
        BoundingBox that = (BoundingBox) o;
        return Double.compare(that.l, l) == 0
                && Double.compare(that.t, t) == 0
                && Double.compare(that.r, r) == 0
                && Double.compare(that.b, b) == 0
                && coordOrigin == that.coordOrigin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(l, t, r, b, coordOrigin);
    }

    @Override
    public String toString() {
        return "BoundingBox{l=" + l + ", t=" + t + ", r=" + r + ", b=" + b + ", origin=" + coordOrigin + "}";
    }
}
