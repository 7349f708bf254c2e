package com.example.cvatserver.util.cvat;

import com.example.cvatserver.util.cvat.dto.CvatElement;
import com.example.cvatserver.util.cvat.dto.DocItemLabel;
import com.example.cvatserver.util.cvat.dto.TreeNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.example.cvatserver.util.cvat.CvatTestElements.element;
import static org.assertj.core.api.Assertions.assertThat;

class ContainmentTreeBuilderTest {

    @Nested
    @DisplayName("建树")
    class Build {

        @Test
        @DisplayName("元素挂到包含它的最小元素下")
        void tightestParentWins() {
            CvatElement page = element(1, DocItemLabel.TEXT, 0, 0, 1000, 1000);
            CvatElement table = element(2, DocItemLabel.TABLE, 100, 100, 500, 500);
            CvatElement cell = element(3, DocItemLabel.TEXT, 110, 110, 200, 200);

            List<TreeNode> roots = ContainmentTreeBuilder.buildContainmentTree(Arrays.asList(cell, page, table));

            assertThat(roots).hasSize(1);
            TreeNode root = roots.get(0);
            assertThat(root.getId()).isEqualTo(1);
            assertThat(root.getChildren()).extracting(TreeNode::getId).containsExactly(2);
            assertThat(root.getChildren().get(0).getChildren()).extracting(TreeNode::getId).containsExactly(3);
        }

        @Test
        @DisplayName("部分重叠不建立父子关系")
        void overlappingBoxesAreNotLinked() {
            CvatElement a = element(1, DocItemLabel.TEXT, 0, 0, 100, 100);
            CvatElement b = element(2, DocItemLabel.TEXT, 50, 50, 150, 150);

            List<TreeNode> roots = ContainmentTreeBuilder.buildContainmentTree(Arrays.asList(a, b));

            assertThat(roots).extracting(TreeNode::getId).containsExactly(1, 2);
            assertThat(roots).allSatisfy(node -> assertThat(node.getChildren()).isEmpty());
        }

        @Test
        @DisplayName("轻微越界仍视为包含")
        void nearContainmentWithinThreshold() {
            CvatElement parent = element(1, DocItemLabel.TABLE, 0, 0, 100, 100);
            CvatElement child = element(2, DocItemLabel.TEXT, -1, 10, 50, 50);

            List<TreeNode> roots = ContainmentTreeBuilder.buildContainmentTree(Arrays.asList(parent, child));

            assertThat(roots).extracting(TreeNode::getId).containsExactly(1);
            assertThat(roots.get(0).getChildren()).extracting(TreeNode::getId).containsExactly(2);
        }

        @Test
        @DisplayName("完全相同的框：ID小者为父，不自包含也不成环")
        void identicalBoxesBreakTieById() {
            CvatElement first = element(5, DocItemLabel.TEXT, 0, 0, 50, 50);
            CvatElement second = element(3, DocItemLabel.TEXT, 0, 0, 50, 50);

            List<TreeNode> roots = ContainmentTreeBuilder.buildContainmentTree(Arrays.asList(first, second));

            assertThat(roots).extracting(TreeNode::getId).containsExactly(3);
            assertThat(roots.get(0).getChildren()).extracting(TreeNode::getId).containsExactly(5);
        }

        @Test
        @DisplayName("同级按上边、左边、ID 排序")
        void siblingsSortedSpatially() {
            CvatElement parent = element(1, DocItemLabel.TEXT, 0, 0, 300, 300);
            CvatElement bottom = element(2, DocItemLabel.TEXT, 10, 200, 100, 250);
            CvatElement topRight = element(3, DocItemLabel.TEXT, 150, 10, 250, 50);
            CvatElement topLeft = element(4, DocItemLabel.TEXT, 10, 10, 100, 50);
            CvatElement sameSpotHigherId = element(6, DocItemLabel.TEXT, 10, 100, 60, 150);
            CvatElement sameSpotLowerId = element(5, DocItemLabel.TEXT, 10, 100, 100, 120);

            List<TreeNode> roots = ContainmentTreeBuilder.buildContainmentTree(
                    Arrays.asList(parent, bottom, topRight, topLeft, sameSpotHigherId, sameSpotLowerId));

            assertThat(roots.get(0).getChildren()).extracting(TreeNode::getId).containsExactly(4, 3, 5, 6, 2);
        }

        @Test
        @DisplayName("空输入返回空森林")
        void emptyInput() {
            assertThat(ContainmentTreeBuilder.buildContainmentTree(Collections.emptyList())).isEmpty();
        }
    }

    @Nested
    @DisplayName("索引")
    class Index {

        private ContainmentTreeBuilder.TreeIndex buildIndex() {
            List<CvatElement> elements = new ArrayList<>();
            elements.add(element(1, DocItemLabel.TEXT, 0, 0, 1000, 1000));
            elements.add(element(2, DocItemLabel.TABLE, 100, 100, 500, 500));
            elements.add(element(3, DocItemLabel.TEXT, 110, 110, 200, 200));
            elements.add(element(4, DocItemLabel.TEXT, 300, 110, 400, 200));
            elements.add(element(5, DocItemLabel.TEXT, 100, 600, 500, 700));
            return ContainmentTreeBuilder.index(ContainmentTreeBuilder.buildContainmentTree(elements));
        }

        @Test
        @DisplayName("祖先由近及远")
        void ancestorsNearestFirst() {
            ContainmentTreeBuilder.TreeIndex index = buildIndex();

            assertThat(index.getAncestors(3)).containsExactly(2, 1);
            assertThat(index.getAncestors(1)).isEmpty();
            assertThat(index.isAncestor(1, 3)).isTrue();
            assertThat(index.isAncestor(3, 1)).isFalse();
            assertThat(index.isAncestor(3, 3)).isFalse();
        }

        @Test
        @DisplayName("子孙集合按先序，不含自身")
        void descendantsInPreorder() {
            ContainmentTreeBuilder.TreeIndex index = buildIndex();

            assertThat(index.getDescendantIds(1)).containsExactly(2, 3, 4, 5);
            assertThat(index.getDescendantIds(2)).containsExactly(3, 4);
            assertThat(index.getDescendantIds(5)).isEmpty();
        }

        @Test
        @DisplayName("空间先序遍历")
        void spatialPreorder() {
            ContainmentTreeBuilder.TreeIndex index = buildIndex();

            assertThat(index.getSpatialPreorder()).extracting(TreeNode::getId).containsExactly(1, 2, 3, 4, 5);
        }

        @Test
        @DisplayName("最低公共祖先")
        void lowestCommonAncestor() {
            ContainmentTreeBuilder.TreeIndex index = buildIndex();

            assertThat(index.lowestCommonAncestor(Arrays.asList(3, 4))).isEqualTo(2);
            assertThat(index.lowestCommonAncestor(Arrays.asList(3, 5))).isEqualTo(1);
            assertThat(index.lowestCommonAncestor(Arrays.asList(2, 3))).isEqualTo(2);
            assertThat(index.lowestCommonAncestor(Collections.singletonList(4))).isEqualTo(4);
        }

        @Test
        @DisplayName("手工组装的树也能建立索引")
        void indexOfManuallyBuiltTree() {
            TreeNode table = new TreeNode(element(10, DocItemLabel.TABLE, 0, 0, 100, 100));
            TreeNode cell = new TreeNode(element(11, DocItemLabel.TEXT, 10, 10, 90, 40));
            table.addChild(cell);

            ContainmentTreeBuilder.TreeIndex index = ContainmentTreeBuilder.index(Collections.singletonList(table));

            assertThat(index.getParentId(11)).isEqualTo(10);
            assertThat(index.getParentId(10)).isNull();
            assertThat(index.getSiblings(11)).extracting(TreeNode::getId).containsExactly(11);
        }
    }
}
