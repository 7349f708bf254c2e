package com.example.cvatserver.service;

import com.example.cvatserver.config.ReadingOrderConfig;
import com.example.cvatserver.util.cvat.ContainmentTreeBuilder;
import com.example.cvatserver.util.cvat.GlobalReadingOrderBuilder;
import com.example.cvatserver.util.cvat.PathElementMapper;
import com.example.cvatserver.util.cvat.ReadingOrderConflictResolver;
import com.example.cvatserver.util.cvat.TableBoundaryPromoter;
import com.example.cvatserver.util.cvat.dto.CvatDocument;
import com.example.cvatserver.util.cvat.dto.CvatElement;
import com.example.cvatserver.util.cvat.dto.CvatImageAnnotation;
import com.example.cvatserver.util.cvat.dto.PathMappings;
import com.example.cvatserver.util.cvat.dto.ReadingOrderResult;
import com.example.cvatserver.util.cvat.dto.TreeNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CVAT 阅读顺序解析服务
 *
 * 单页流程：
 * 1. 构建包含树
 * 2. 路径点 -> 元素映射，推断嵌套路径容器
 * 3. 多层级冲突消解
 * 4. 表格跨边界提升
 * 5. 组装全局阅读顺序
 *
 * 每一步都产出新的映射，页与页之间没有共享状态。
 */
@Slf4j
@Service
public class CvatReadingOrderService {

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ReadingOrderConfig config;

    public CvatReadingOrderService(ReadingOrderConfig config) {
        this.config = config;
    }

    /**
     * 解析整份标注文件（逐页）
     *
     * @param document 标注文件
     * @return 每页一个结果，顺序与文件一致
     */
    public List<ReadingOrderResult> resolveDocument(CvatDocument document) {
        List<ReadingOrderResult> results = new ArrayList<>();
        for (CvatImageAnnotation image : document.getImages()) {
            results.add(resolvePage(image));
        }
        return results;
    }

    /**
     * 解析单页阅读顺序
     *
     * @param image 单页标注
     * @return 解析结果
     */
    public ReadingOrderResult resolvePage(CvatImageAnnotation image) {
        long start = System.currentTimeMillis();
        List<CvatElement> elements = image.getElements();

        // Step 1: 包含树
        List<TreeNode> roots = ContainmentTreeBuilder.buildContainmentTree(elements, config.getContainmentThreshold());
        ContainmentTreeBuilder.TreeIndex index = ContainmentTreeBuilder.index(roots);

        // Step 2: 路径映射
        PathMappings mappings = PathElementMapper.mapPathPointsToElements(
                image.getPaths(), elements, config.getPointTolerance());
        Map<Integer, Integer> pathToContainer = PathElementMapper.mapPathsToContainers(
                image.getPaths(), mappings, elements, config.getPointTolerance());

        // Step 3: 冲突消解
        Map<Integer, List<Integer>> resolved = ReadingOrderConflictResolver.resolveReadingOrderConflicts(
                mappings.getReadingOrder(), image.getPaths(), index);
        mappings = mappings.withReadingOrder(resolved);

        // Step 4: 表格跨边界提升
        mappings = TableBoundaryPromoter.promoteTableCrossBoundaryReadingOrder(
                mappings, image.getPaths(), roots, config.getTableTolerance());

        // Step 5: 全局顺序
        List<Integer> globalOrder = GlobalReadingOrderBuilder.buildGlobalReadingOrder(
                image.getPaths(), mappings.getReadingOrder(), pathToContainer, roots);

        ReadingOrderResult result = new ReadingOrderResult();
        result.setImageId(image.getImageId());
        result.setImageName(image.getName());
        result.setWidth(image.getWidth());
        result.setHeight(image.getHeight());
        result.setGlobalOrder(globalOrder);
        result.setMappings(mappings);
        result.setPathToContainer(pathToContainer);
        List<ReadingOrderResult.TreeView> tree = new ArrayList<>();
        for (TreeNode root : index.getRoots()) {
            tree.add(ReadingOrderResult.TreeView.of(root));
        }
        result.setContainmentTree(tree);
        result.setElements(elements);

        log.info("图片 {} 阅读顺序解析完成: 元素={}, 路径={}, 耗时={}ms",
                image.getName(), elements.size(), image.getPaths().size(), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 导出解析结果为JSON文件（格式化输出）
     *
     * @param results 解析结果
     * @param outputPath 输出路径
     * @throws IOException 写入失败
     */
    public void writeResultJson(List<ReadingOrderResult> results, Path outputPath) throws IOException {
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        String json = mapper.writeValueAsString(results);
        Files.write(outputPath, json.getBytes(StandardCharsets.UTF_8));
        log.info("阅读顺序结果已保存: {} ({} 页)", outputPath, results.size());
    }
}
