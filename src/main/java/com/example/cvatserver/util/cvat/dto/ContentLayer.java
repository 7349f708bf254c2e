package com.example.cvatserver.util.cvat.dto;

import java.util.Locale;

/**
 * 内容层分类（正文 / 页眉页脚等版面装饰）
 */
public enum ContentLayer {
    BODY,
    FURNITURE,
    BACKGROUND,
    INVISIBLE,
    NOTES;

    /**
     * 解析 CVAT 属性值（大小写不敏感）
     *
     * @param value 属性值
     * @param defaultLayer 无法识别时的默认值
     * @return 内容层
     */
    public static ContentLayer parse(String value, ContentLayer defaultLayer) {
        if (value == null || value.trim().isEmpty()) {
            return defaultLayer;
        }
        try {
            return ContentLayer.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultLayer;
        }
    }
}
