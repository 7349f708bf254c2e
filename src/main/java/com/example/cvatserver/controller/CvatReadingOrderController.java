package com.example.cvatserver.controller;

import com.example.cvatserver.service.CvatReadingOrderService;
import com.example.cvatserver.util.cvat.CvatXmlParser;
import com.example.cvatserver.util.cvat.dto.CvatDocument;
import com.example.cvatserver.util.cvat.dto.ReadingOrderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CVAT 标注阅读顺序控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/cvat")
public class CvatReadingOrderController {

    @Autowired
    private CvatReadingOrderService readingOrderService;

    /**
     * 上传CVAT标注XML，返回每页的全局阅读顺序
     *
     * @param file CVAT for images 1.1 XML
     * @param imageName 只解析指定图片（可选）
     * @return 包含 images 列表的JSON响应
     */
    @PostMapping("/reading-order")
    public ResponseEntity<Map<String, Object>> resolveReadingOrder(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "imageName", required = false) String imageName) {

        Map<String, Object> result = new HashMap<>();

        // 验证文件
        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".xml")) {
            result.put("success", false);
            result.put("message", "只支持.xml标注文件");
            return ResponseEntity.badRequest().body(result);
        }

        try {
            log.info("接收标注文件: {}, imageName={}", originalFilename, imageName);

            CvatDocument document;
            try (InputStream in = file.getInputStream()) {
                document = CvatXmlParser.parseCvatXml(in);
            }

            List<ReadingOrderResult> images;
            if (imageName != null && !imageName.isEmpty()) {
                images = Collections.singletonList(readingOrderService.resolvePage(document.getImage(imageName)));
            } else {
                images = readingOrderService.resolveDocument(document);
            }

            result.put("success", true);
            result.put("images", images);
            return ResponseEntity.ok(result);

        } catch (IllegalArgumentException e) {
            log.warn("标注文件解析失败: {}", e.getMessage());
            result.put("success", false);
            result.put("message", "标注文件解析失败: " + e.getMessage());
            return ResponseEntity.badRequest().body(result);
        } catch (IOException e) {
            log.error("读取上传文件失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "读取上传文件失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        } catch (Exception e) {
            log.error("阅读顺序解析失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "阅读顺序解析失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 健康检查
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        return ResponseEntity.ok(result);
    }
}
