package com.example.cvatserver.util.cvat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 路径关系映射集合（不可变）
 *
 * readingOrder 为阅读顺序（路径ID -> 有序元素ID列表），是各处理步骤的主要产物；
 * 其余映射（merge/group/toCaption/toFootnote/toValue）原样透传。
 *
 * 各处理步骤不修改实例，通过 {@link #withReadingOrder(Map)} 得到新实例。
 */
@JsonPropertyOrder({"reading_order", "merge", "group", "to_caption", "to_footnote", "to_value"})
public final class PathMappings {

    private final Map<Integer, List<Integer>> readingOrder;
    private final Map<Integer, List<Integer>> merge;
    private final Map<Integer, List<Integer>> group;
    private final Map<Integer, List<Integer>> toCaption;
    private final Map<Integer, List<Integer>> toFootnote;
    private final Map<Integer, List<Integer>> toValue;

    public PathMappings(Map<Integer, List<Integer>> readingOrder,
                        Map<Integer, List<Integer>> merge,
                        Map<Integer, List<Integer>> group,
                        Map<Integer, List<Integer>> toCaption,
                        Map<Integer, List<Integer>> toFootnote,
                        Map<Integer, List<Integer>> toValue) {
        this.readingOrder = freeze(readingOrder);
        this.merge = freeze(merge);
        this.group = freeze(group);
        this.toCaption = freeze(toCaption);
        this.toFootnote = freeze(toFootnote);
        this.toValue = freeze(toValue);
    }

    /**
     * 替换阅读顺序，其余映射保持不变
     */
    public PathMappings withReadingOrder(Map<Integer, List<Integer>> newReadingOrder) {
        return new PathMappings(newReadingOrder, merge, group, toCaption, toFootnote, toValue);
    }

    @JsonProperty("reading_order")
    public Map<Integer, List<Integer>> getReadingOrder() {
        return readingOrder;
    }

    @JsonProperty("merge")
    public Map<Integer, List<Integer>> getMerge() {
        return merge;
    }

    @JsonProperty("group")
    public Map<Integer, List<Integer>> getGroup() {
        return group;
    }

    @JsonProperty("to_caption")
    public Map<Integer, List<Integer>> getToCaption() {
        return toCaption;
    }

    @JsonProperty("to_footnote")
    public Map<Integer, List<Integer>> getToFootnote() {
        return toFootnote;
    }

    @JsonProperty("to_value")
    public Map<Integer, List<Integer>> getToValue() {
        return toValue;
    }

    /**
     * 可修改的深拷贝（保持键顺序），供处理步骤在局部构造新映射
     */
    public static Map<Integer, List<Integer>> mutableCopy(Map<Integer, List<Integer>> source) {
        Map<Integer, List<Integer>> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<Integer, List<Integer>> entry : source.entrySet()) {
                copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
            }
        }
        return copy;
    }

    private static Map<Integer, List<Integer>> freeze(Map<Integer, List<Integer>> source) {
        Map<Integer, List<Integer>> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<Integer, List<Integer>> entry : source.entrySet()) {
                copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "PathMappings{readingOrder=" + readingOrder + ", merge=" + merge + ", group=" + group
                + ", toCaption=" + toCaption + ", toFootnote=" + toFootnote + ", toValue=" + toValue + "}";
    }
}
