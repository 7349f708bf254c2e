package com.example.cvatserver.util.cvat.dto;

import java.util.Collections;
import java.util.List;

/**
 * CVAT 标注文件解析结果（按 image 分页）
 */
public final class CvatDocument {
    private final List<CvatImageAnnotation> images;

    public CvatDocument(List<CvatImageAnnotation> images) {
        this.images = Collections.unmodifiableList(images);
    }

    public List<CvatImageAnnotation> getImages() {
        return images;
    }

    /**
     * 按图片名查找
     *
     * @param name image 节点的 name 属性
     * @return 该页标注
     * @throws IllegalArgumentException 不存在该图片时
     */
    public CvatImageAnnotation getImage(String name) {
        for (CvatImageAnnotation image : images) {
            if (image.getName().equals(name)) {
                return image;
            }
        }
        throw new IllegalArgumentException("标注文件中不存在图片: " + name);
    }
}
