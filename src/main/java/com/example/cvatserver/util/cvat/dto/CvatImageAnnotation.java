package com.example.cvatserver.util.cvat.dto;

import java.util.Collections;
import java.util.List;

/**
 * 单页（CVAT image 节点）的标注内容
 */
public final class CvatImageAnnotation {
    private final int imageId;
    private final String name;
    private final double width;
    private final double height;
    private final List<CvatElement> elements;
    private final List<CvatAnnotationPath> paths;

    public CvatImageAnnotation(int imageId, String name, double width, double height,
                               List<CvatElement> elements, List<CvatAnnotationPath> paths) {
        this.imageId = imageId;
        this.name = name;
        this.width = width;
        this.height = height;
        this.elements = Collections.unmodifiableList(elements);
        this.paths = Collections.unmodifiableList(paths);
    }

    public int getImageId() {
        return imageId;
    }

    public String getName() {
        return name;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public List<CvatElement> getElements() {
        return elements;
    }

    public List<CvatAnnotationPath> getPaths() {
        return paths;
    }
}
