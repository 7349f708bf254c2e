package com.example.cvatserver.util.cvat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 页面元素（CVAT box 标注解析结果，不可变）
 *
 * 当 rotationDeg 非零时：bboxUnrotated 为标注时画出的框，
 * bbox 为其绕中心旋转后的外接轴对齐框（同一坐标系）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CvatElement {

    @JsonProperty("id")
    private final int id;

    @JsonProperty("label")
    private final DocItemLabel label;

    @JsonProperty("bbox")
    private final BoundingBox bbox;

    @JsonProperty("content_layer")
    private final ContentLayer contentLayer;

    @JsonProperty("rotation_deg")
    private final Double rotationDeg;

    @JsonProperty("bbox_unrotated")
    private final BoundingBox bboxUnrotated;

    @JsonProperty("type")
    private final String type;       // CVAT type 属性（可选）

    @JsonProperty("level")
    private final Integer level;     // CVAT level 属性（可选，如列表层级）

    public CvatElement(int id, DocItemLabel label, BoundingBox bbox, ContentLayer contentLayer) {
        this(id, label, bbox, contentLayer, null, null, null, null);
    }

    public CvatElement(int id,
                       DocItemLabel label,
                       BoundingBox bbox,
                       ContentLayer contentLayer,
                       Double rotationDeg,
                       BoundingBox bboxUnrotated,
                       String type,
                       Integer level) {
        this.id = id;
        this.label = Objects.requireNonNull(label, "label");
        this.bbox = Objects.requireNonNull(bbox, "bbox");
        this.contentLayer = contentLayer != null ? contentLayer : ContentLayer.BODY;
        this.rotationDeg = rotationDeg;
        this.bboxUnrotated = bboxUnrotated;
        this.type = type;
        this.level = level;
    }

    public int getId() {
        return id;
    }

    public DocItemLabel getLabel() {
        return label;
    }

    public BoundingBox getBbox() {
        return bbox;
    }

    public ContentLayer getContentLayer() {
        return contentLayer;
    }

    public Double getRotationDeg() {
        return rotationDeg;
    }

    public BoundingBox getBboxUnrotated() {
        return bboxUnrotated;
    }

    public String getType() {
        return type;
    }

    public Integer getLevel() {
        return level;
    }

    @Override
    public String toString() {
        return "CvatElement{id=" + id + ", label=" + label + ", bbox=" + bbox + "}";
    }
}
