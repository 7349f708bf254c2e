package com.example.cvatserver.util.cvat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 单页阅读顺序解析结果（导出给下游）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReadingOrderResult {

    @JsonProperty("image_id")
    private int imageId;

    @JsonProperty("image_name")
    private String imageName;

    @JsonProperty("width")
    private double width;

    @JsonProperty("height")
    private double height;

    @JsonProperty("global_order")
    private List<Integer> globalOrder;

    @JsonProperty("mappings")
    private PathMappings mappings;

    @JsonProperty("path_to_container")
    private Map<Integer, Integer> pathToContainer;

    @JsonProperty("containment_tree")
    private List<TreeView> containmentTree;

    @JsonProperty("elements")
    private List<CvatElement> elements;

    // Getters and Setters
    public int getImageId() { return imageId; }
    public void setImageId(int imageId) { this.imageId = imageId; }

    public String getImageName() { return imageName; }
    public void setImageName(String imageName) { this.imageName = imageName; }

    public double getWidth() { return width; }
    public void setWidth(double width) { this.width = width; }

    public double getHeight() { return height; }
    public void setHeight(double height) { this.height = height; }

    public List<Integer> getGlobalOrder() { return globalOrder; }
    public void setGlobalOrder(List<Integer> globalOrder) { this.globalOrder = globalOrder; }

    public PathMappings getMappings() { return mappings; }
    public void setMappings(PathMappings mappings) { this.mappings = mappings; }

    public Map<Integer, Integer> getPathToContainer() { return pathToContainer; }
    public void setPathToContainer(Map<Integer, Integer> pathToContainer) { this.pathToContainer = pathToContainer; }

    public List<TreeView> getContainmentTree() { return containmentTree; }
    public void setContainmentTree(List<TreeView> containmentTree) { this.containmentTree = containmentTree; }

    public List<CvatElement> getElements() { return elements; }
    public void setElements(List<CvatElement> elements) { this.elements = elements; }

    /**
     * 包含树的导出视图（只含ID与标签）
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class TreeView {
        @JsonProperty("id")
        private int id;

        @JsonProperty("label")
        private DocItemLabel label;

        @JsonProperty("children")
        private List<TreeView> children = new ArrayList<>();

        public static TreeView of(TreeNode node) {
            TreeView view = new TreeView();
            view.id = node.getId();
            view.label = node.getElement().getLabel();
            for (TreeNode child : node.getChildren()) {
                view.children.add(of(child));
            }
            return view;
        }

        public int getId() { return id; }
        public DocItemLabel getLabel() { return label; }
        public List<TreeView> getChildren() { return children; }
    }
}
