package com.example.cvatserver.util.cvat;

import com.example.cvatserver.util.cvat.dto.CvatAnnotationPath;
import com.example.cvatserver.util.cvat.dto.CvatElement;
import com.example.cvatserver.util.cvat.dto.DocItemLabel;
import com.example.cvatserver.util.cvat.dto.TreeNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.cvatserver.util.cvat.CvatTestElements.element;
import static com.example.cvatserver.util.cvat.CvatTestElements.readingPath;
import static org.assertj.core.api.Assertions.assertThat;

class GlobalReadingOrderBuilderTest {

    private static List<Integer> build(List<CvatElement> elements,
                                       List<CvatAnnotationPath> paths,
                                       Map<Integer, List<Integer>> pathToElements,
                                       Map<Integer, Integer> pathToContainer) {
        List<TreeNode> roots = ContainmentTreeBuilder.buildContainmentTree(elements);
        return GlobalReadingOrderBuilder.buildGlobalReadingOrder(paths, pathToElements, pathToContainer, roots);
    }

    @Nested
    @DisplayName("外层路径")
    class OuterPaths {

        @Test
        @DisplayName("路径顺序优先于空间顺序")
        void pathOrderWinsOverSpatialOrder() {
            List<CvatElement> elements = Arrays.asList(
                    element(200, DocItemLabel.SECTION_HEADER, 0, 0, 100, 20),
                    element(201, DocItemLabel.TEXT, 0, 30, 100, 60));
            Map<Integer, List<Integer>> mapping = new HashMap<>();
            mapping.put(1, Arrays.asList(201, 200));

            List<Integer> order = build(elements, Collections.singletonList(readingPath(1, 1, 0, 0)),
                    mapping, Collections.emptyMap());

            assertThat(order).containsExactly(201, 200);
        }

        @Test
        @DisplayName("标题嵌在文本块内：路径从标题走到所在文本块时按路径顺序输出")
        void childThenOwnParent() {
            List<CvatElement> elements = Arrays.asList(
                    element(200, DocItemLabel.TEXT, 0, 0, 100, 40),
                    element(201, DocItemLabel.SECTION_HEADER, 10, 5, 90, 20));
            Map<Integer, List<Integer>> mapping = new HashMap<>();
            mapping.put(1, Arrays.asList(201, 200));

            List<Integer> order = build(elements, Collections.singletonList(readingPath(1, 1, 0, 0)),
                    mapping, Collections.emptyMap());

            assertThat(order).containsExactly(201, 200);
        }

        @Test
        @DisplayName("离开父节点时父节点紧跟最后一个子元素输出")
        void unpathedParentClosesAfterChild() {
            List<CvatElement> elements = Arrays.asList(
                    element(300, DocItemLabel.PICTURE, 0, 0, 200, 200),
                    element(301, DocItemLabel.TEXT, 10, 10, 190, 40),
                    element(302, DocItemLabel.TEXT, 10, 300, 190, 330));
            Map<Integer, List<Integer>> mapping = new HashMap<>();
            mapping.put(1, Arrays.asList(301, 302));

            List<Integer> order = build(elements, Collections.singletonList(readingPath(1, 1, 0, 0)),
                    mapping, Collections.emptyMap());

            assertThat(order).containsExactly(301, 300, 302);
        }

        @Test
        @DisplayName("进入父节点时父节点紧贴第一个子元素之前输出")
        void unpathedParentOpensBeforeChild() {
            List<CvatElement> elements = Arrays.asList(
                    element(1, DocItemLabel.TEXT, 0, 0, 100, 10),
                    element(2, DocItemLabel.PICTURE, 0, 20, 100, 100),
                    element(3, DocItemLabel.SECTION_HEADER, 10, 30, 90, 40),
                    element(4, DocItemLabel.TEXT, 10, 50, 90, 90));
            Map<Integer, List<Integer>> mapping = new HashMap<>();
            mapping.put(1, Arrays.asList(1, 3, 4));

            List<Integer> order = build(elements, Collections.singletonList(readingPath(1, 1, 0, 0)),
                    mapping, Collections.emptyMap());

            assertThat(order).containsExactly(1, 2, 3, 4);
        }

        @Test
        @DisplayName("包含树之外的ID被忽略")
        void unknownIdsAreIgnored() {
            List<CvatElement> elements = Collections.singletonList(element(1, DocItemLabel.TEXT, 0, 0, 10, 10));
            Map<Integer, List<Integer>> mapping = new HashMap<>();
            mapping.put(1, Arrays.asList(999, 1, 1));

            List<Integer> order = build(elements, Collections.singletonList(readingPath(1, 1, 0, 0)),
                    mapping, Collections.emptyMap());

            assertThat(order).containsExactly(1);
        }
    }

    @Nested
    @DisplayName("嵌套路径")
    class NestedPaths {

        private final List<CvatElement> elements = Arrays.asList(
                element(1, DocItemLabel.TITLE, 0, 0, 100, 10),
                element(2, DocItemLabel.TABLE, 0, 20, 100, 60),
                element(3, DocItemLabel.TEXT, 0, 20, 50, 60),
                element(4, DocItemLabel.TEXT, 50, 20, 100, 60),
                element(5, DocItemLabel.TEXT, 0, 70, 100, 80),
                element(6, DocItemLabel.TEXT, 0, 90, 100, 100));

        private final List<CvatAnnotationPath> paths = Arrays.asList(
                readingPath(10, 1, 0, 0),
                readingPath(11, 2, 0, 0));

        private Map<Integer, List<Integer>> mapping(List<Integer> outer) {
            Map<Integer, List<Integer>> mapping = new LinkedHashMap<>();
            mapping.put(10, outer);
            mapping.put(11, Arrays.asList(4, 3));
            return mapping;
        }

        @Test
        @DisplayName("容器未被外层路径放置：容器按空间兜底放置后紧跟嵌套顺序")
        void pendingBlockFollowsContainer() {
            List<Integer> order = build(elements, paths, mapping(Arrays.asList(1, 5, 6)),
                    Collections.singletonMap(11, 2));

            assertThat(order).containsExactly(1, 2, 4, 3, 5, 6);
        }

        @Test
        @DisplayName("容器已在外层路径中：嵌套顺序紧跟容器")
        void nestedBlockFollowsPlacedContainer() {
            List<Integer> order = build(elements, paths, mapping(Arrays.asList(1, 2, 5, 6)),
                    Collections.singletonMap(11, 2));

            assertThat(order).containsExactly(1, 2, 4, 3, 5, 6);
        }

        @Test
        @DisplayName("外层路径已放置的单元格被嵌套顺序重排")
        void nestedOrderOverridesOuterPlacement() {
            List<Integer> order = build(elements, paths, mapping(Arrays.asList(1, 3, 5)),
                    Collections.singletonMap(11, 2));

            assertThat(order).containsExactly(1, 2, 4, 3, 5, 6);
        }

        @Test
        @DisplayName("没有显式容器时取最低公共祖先")
        void containerFallsBackToLowestCommonAncestor() {
            List<Integer> order = build(elements, paths, mapping(Arrays.asList(1, 5, 6)),
                    Collections.emptyMap());

            assertThat(order).containsExactly(1, 2, 4, 3, 5, 6);
        }
    }

    @Nested
    @DisplayName("空间兜底")
    class Fallback {

        @Test
        @DisplayName("没有路径时按空间先序输出")
        void noPathsUsesSpatialPreorder() {
            List<CvatElement> elements = Arrays.asList(
                    element(7, DocItemLabel.TEXT, 0, 50, 100, 60),
                    element(8, DocItemLabel.TABLE, 0, 0, 100, 40),
                    element(9, DocItemLabel.TEXT, 50, 10, 90, 30),
                    element(10, DocItemLabel.TEXT, 5, 10, 45, 30));

            List<Integer> order = build(elements, Collections.emptyList(), Collections.emptyMap(),
                    Collections.emptyMap());

            assertThat(order).containsExactly(8, 10, 9, 7);
        }

        @Test
        @DisplayName("未被路径覆盖的元素插在前一个兄弟区块之后")
        void leftoverFollowsPreviousSibling() {
            List<CvatElement> elements = Arrays.asList(
                    element(1, DocItemLabel.PAGE_HEADER, 0, 0, 100, 10),
                    element(2, DocItemLabel.TEXT, 0, 20, 100, 30),
                    element(3, DocItemLabel.TEXT, 0, 40, 100, 50),
                    element(4, DocItemLabel.TEXT, 0, 60, 100, 70));
            Map<Integer, List<Integer>> mapping = new HashMap<>();
            mapping.put(1, Arrays.asList(3, 2));

            List<Integer> order = build(elements, Collections.singletonList(readingPath(1, 1, 0, 0)),
                    mapping, Collections.emptyMap());

            assertThat(order).containsExactly(1, 3, 4, 2);
        }
    }

    @Test
    @DisplayName("每个元素恰好出现一次，且结果可复现")
    void everyElementOnceAndDeterministic() {
        List<CvatElement> elements = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            elements.add(element(i, DocItemLabel.TEXT, 0, i * 20, 100, i * 20 + 10));
        }
        elements.add(element(6, DocItemLabel.PICTURE, 0, 200, 100, 300));
        elements.add(element(7, DocItemLabel.CAPTION, 10, 210, 90, 220));

        Map<Integer, List<Integer>> mapping = new LinkedHashMap<>();
        mapping.put(1, Arrays.asList(5, 7, 0));
        mapping.put(2, Arrays.asList(3, 1));
        List<CvatAnnotationPath> paths = Arrays.asList(readingPath(1, 1, 0, 0), readingPath(2, 1, 0, 0));

        List<Integer> first = build(elements, paths, mapping, Collections.emptyMap());
        List<Integer> second = build(elements, paths, mapping, Collections.emptyMap());

        assertThat(first).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(first).doesNotHaveDuplicates();
        assertThat(first).isEqualTo(second);
        assertThat(first.indexOf(5)).isLessThan(first.indexOf(7));
        assertThat(first.indexOf(7)).isLessThan(first.indexOf(0));
        assertThat(first.indexOf(3)).isLessThan(first.indexOf(1));
    }
}
