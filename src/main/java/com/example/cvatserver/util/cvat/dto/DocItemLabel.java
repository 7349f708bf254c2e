package com.example.cvatserver.util.cvat.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 文档元素标签（封闭枚举）
 *
 * 标签相关的行为一律用判断函数表达（如 {@link #isTableLike()}），不做多态分派。
 */
public enum DocItemLabel {
    CAPTION("caption"),
    CHART("chart"),
    CHECKBOX_SELECTED("checkbox_selected"),
    CHECKBOX_UNSELECTED("checkbox_unselected"),
    CODE("code"),
    DOCUMENT_INDEX("document_index"),
    EMPTY_VALUE("empty_value"),
    FOOTNOTE("footnote"),
    FORM("form"),
    FORMULA("formula"),
    GRADING_SCALE("grading_scale"),
    HANDWRITTEN_TEXT("handwritten_text"),
    KEY_VALUE_REGION("key_value_region"),
    LIST_ITEM("list_item"),
    PAGE_FOOTER("page_footer"),
    PAGE_HEADER("page_header"),
    PICTURE("picture"),
    REFERENCE("reference"),
    SECTION_HEADER("section_header"),
    TABLE("table"),
    TEXT("text"),
    TITLE("title");

    private static final Map<String, DocItemLabel> BY_NAME = new HashMap<>();

    static {
        for (DocItemLabel label : values()) {
            BY_NAME.put(label.cvatName, label);
        }
    }

    private final String cvatName;

    DocItemLabel(String cvatName) {
        this.cvatName = cvatName;
    }

    /**
     * 导出JSON时使用CVAT标签名
     */
    @JsonValue
    public String getCvatName() {
        return cvatName;
    }

    /**
     * 是否按表格处理（跨边界提升）
     */
    public boolean isTableLike() {
        return this == TABLE || this == DOCUMENT_INDEX;
    }

    /**
     * 是否默认属于版面装饰层（页眉页脚）
     */
    public boolean isFurniture() {
        return this == PAGE_HEADER || this == PAGE_FOOTER;
    }

    /**
     * 按 CVAT 标签名查找（大小写、空格、连字符不敏感）
     *
     * @param name CVAT 标签名，如 "section_header"、"Section-header"
     * @return 对应标签，无法识别时返回 null
     */
    public static DocItemLabel fromCvatName(String name) {
        if (name == null) {
            return null;
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return BY_NAME.get(key);
    }
}
