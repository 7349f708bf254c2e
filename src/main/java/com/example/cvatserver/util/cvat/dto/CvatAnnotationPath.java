package com.example.cvatserver.util.cvat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 标注路径（CVAT polyline，不可变）
 *
 * level = 1 为全局（最外层）路径，更大的 level 表示限定在某个容器内部的路径（如表格内部）。
 */
public final class CvatAnnotationPath {

    public static final String READING_ORDER = "reading_order";
    public static final String MERGE = "merge";
    public static final String GROUP = "group";
    public static final String TO_CAPTION = "to_caption";
    public static final String TO_FOOTNOTE = "to_footnote";
    public static final String TO_VALUE = "to_value";

    @JsonProperty("id")
    private final int id;

    @JsonProperty("label")
    private final String label;

    @JsonProperty("points")
    private final List<double[]> points;

    @JsonProperty("level")
    private final int level;

    public CvatAnnotationPath(int id, String label, List<double[]> points) {
        this(id, label, points, 1);
    }

    public CvatAnnotationPath(int id, String label, List<double[]> points, int level) {
        this.id = id;
        this.label = Objects.requireNonNull(label, "label");
        List<double[]> copy = new ArrayList<>(points.size());
        for (double[] p : points) {
            copy.add(new double[]{p[0], p[1]});
        }
        this.points = Collections.unmodifiableList(copy);
        this.level = level;
    }

    public int getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return 折线点序列，每个点为 {x, y}（返回副本，调用方修改不影响本对象）
     */
    public List<double[]> getPoints() {
        List<double[]> copy = new ArrayList<>(points.size());
        for (double[] p : points) {
            copy.add(new double[]{p[0], p[1]});
        }
        return copy;
    }

    public int getLevel() {
        return level;
    }

    public boolean isReadingOrder() {
        return READING_ORDER.equals(label);
    }

    @Override
    public String toString() {
        return "CvatAnnotationPath{id=" + id + ", label='" + label + "', level=" + level + ", points=" + points.size() + "}";
    }
}
