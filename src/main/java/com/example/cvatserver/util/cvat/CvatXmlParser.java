package com.example.cvatserver.util.cvat;

import com.example.cvatserver.util.cvat.coordinate.RotatedBoxUtils;
import com.example.cvatserver.util.cvat.dto.BoundingBox;
import com.example.cvatserver.util.cvat.dto.ContentLayer;
import com.example.cvatserver.util.cvat.dto.CvatAnnotationPath;
import com.example.cvatserver.util.cvat.dto.CvatDocument;
import com.example.cvatserver.util.cvat.dto.CvatElement;
import com.example.cvatserver.util.cvat.dto.CvatImageAnnotation;
import com.example.cvatserver.util.cvat.dto.DocItemLabel;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CVAT 标注文件解析器（CVAT for images 1.1 XML）
 *
 * <pre>
 * &lt;annotations&gt;
 *   &lt;image id="1" name="page.png" width="100" height="100"&gt;
 *     &lt;box label="text" xtl="30" ytl="10" xbr="70" ybr="90" rotation="90.0"&gt;
 *       &lt;attribute name="content_layer"&gt;BODY&lt;/attribute&gt;
 *     &lt;/box&gt;
 *     &lt;polyline label="reading_order" points="20,20;20,160"&gt;
 *       &lt;attribute name="level"&gt;1&lt;/attribute&gt;
 *     &lt;/polyline&gt;
 *   &lt;/image&gt;
 * &lt;/annotations&gt;
 * </pre>
 *
 * 约定：
 * - 坐标为图像像素坐标（左上角原点）
 * - rotation 非零时：bboxUnrotated 记录画出的框，bbox 为旋转后的外接框
 * - 元素、路径ID按每页文档顺序从0分配
 * - 非法几何（宽高不为正的框、少于2个点的折线）跳过并告警
 */
public class CvatXmlParser {

    private static final Logger log = LoggerFactory.getLogger(CvatXmlParser.class);

    private static final String ATTR_CONTENT_LAYER = "content_layer";
    private static final String ATTR_TYPE = "type";
    private static final String ATTR_LEVEL = "level";

    /**
     * 解析标注文件
     *
     * @param xmlPath 文件路径
     * @return 解析结果
     * @throws IOException 文件读取失败
     */
    public static CvatDocument parseCvatFile(Path xmlPath) throws IOException {
        if (!Files.exists(xmlPath)) {
            throw new IOException("标注文件不存在: " + xmlPath);
        }
        log.info("解析CVAT标注文件: {}", xmlPath);
        try (InputStream in = Files.newInputStream(xmlPath)) {
            return parseCvatXml(in);
        }
    }

    /**
     * 解析标注XML字节流，字符集取自XML声明（缺省UTF-8）
     *
     * @param in XML字节流（调用方负责关闭）
     * @return 解析结果
     * @throws IOException 读取失败
     * @throws IllegalArgumentException 缺少 annotations 根节点
     */
    public static CvatDocument parseCvatXml(InputStream in) throws IOException {
        return parseDocument(Jsoup.parse(in, null, "", Parser.xmlParser()));
    }

    /**
     * 解析标注XML文本
     *
     * @param xml XML内容
     * @return 解析结果
     * @throws IllegalArgumentException 缺少 annotations 根节点
     */
    public static CvatDocument parseCvatXml(String xml) {
        return parseDocument(Jsoup.parse(xml, "", Parser.xmlParser()));
    }

    private static CvatDocument parseDocument(Document doc) {
        Element root = doc.selectFirst("annotations");
        if (root == null) {
            throw new IllegalArgumentException("不是CVAT标注文件：缺少 <annotations> 根节点");
        }

        List<CvatImageAnnotation> images = new ArrayList<>();
        for (Element image : root.getElementsByTag("image")) {
            images.add(parseImage(image));
        }

        log.info("CVAT标注解析完成: 图片={}", images.size());
        return new CvatDocument(images);
    }

    private static CvatImageAnnotation parseImage(Element image) {
        String name = image.attr("name");
        int imageId = (int) parseDouble(image.attr("id"), 0);
        double width = parseDouble(image.attr("width"), 0);
        double height = parseDouble(image.attr("height"), 0);

        List<CvatElement> elements = new ArrayList<>();
        List<CvatAnnotationPath> paths = new ArrayList<>();

        for (Element shape : image.children()) {
            String tag = shape.tagName();
            if ("box".equals(tag)) {
                CvatElement element = parseBox(shape, elements.size(), name);
                if (element != null) {
                    elements.add(element);
                }
            } else if ("polyline".equals(tag)) {
                CvatAnnotationPath path = parsePolyline(shape, paths.size(), name);
                if (path != null) {
                    paths.add(path);
                }
            } else {
                log.debug("图片 {}: 忽略不支持的标注类型 <{}>", name, tag);
            }
        }

        log.info("图片 {}: 元素={}, 路径={}", name, elements.size(), paths.size());
        return new CvatImageAnnotation(imageId, name, width, height, elements, paths);
    }

    private static CvatElement parseBox(Element box, int id, String imageName) {
        String labelName = box.attr("label");
        DocItemLabel label = DocItemLabel.fromCvatName(labelName);
        if (label == null) {
            log.warn("图片 {}: 未知标签 '{}'，跳过", imageName, labelName);
            return null;
        }

        double xtl = parseDouble(box.attr("xtl"), Double.NaN);
        double ytl = parseDouble(box.attr("ytl"), Double.NaN);
        double xbr = parseDouble(box.attr("xbr"), Double.NaN);
        double ybr = parseDouble(box.attr("ybr"), Double.NaN);
        if (Double.isNaN(xtl) || Double.isNaN(ytl) || Double.isNaN(xbr) || Double.isNaN(ybr)
                || xbr <= xtl || ybr <= ytl) {
            log.warn("图片 {}: 标签 '{}' 的框坐标非法 ({}, {}, {}, {})，跳过", imageName, labelName, xtl, ytl, xbr, ybr);
            return null;
        }

        Map<String, String> attributes = readAttributes(box);
        ContentLayer defaultLayer = label.isFurniture() ? ContentLayer.FURNITURE : ContentLayer.BODY;
        ContentLayer layer = ContentLayer.parse(attributes.get(ATTR_CONTENT_LAYER), defaultLayer);
        Integer level = parseInteger(attributes.get(ATTR_LEVEL));

        BoundingBox drawn = BoundingBox.topLeft(xtl, ytl, xbr, ybr);
        double rotation = parseDouble(box.attr("rotation"), 0.0);

        if (rotation != 0.0) {
            BoundingBox enclosing = RotatedBoxUtils.bboxEnclosingRotatedRect(drawn, rotation);
            return new CvatElement(id, label, enclosing, layer, rotation, drawn, attributes.get(ATTR_TYPE), level);
        }
        return new CvatElement(id, label, drawn, layer, null, null, attributes.get(ATTR_TYPE), level);
    }

    private static CvatAnnotationPath parsePolyline(Element polyline, int id, String imageName) {
        String label = polyline.attr("label").trim();
        List<double[]> points = parsePoints(polyline.attr("points"));
        if (points.size() < 2) {
            log.warn("图片 {}: 路径 '{}' 点数不足2个，跳过", imageName, label);
            return null;
        }

        Integer level = parseInteger(readAttributes(polyline).get(ATTR_LEVEL));
        return new CvatAnnotationPath(id, label, points, level != null ? level : 1);
    }

    /**
     * 解析 "x1,y1;x2,y2;..."，无法解析的点被丢弃
     */
    static List<double[]> parsePoints(String raw) {
        List<double[]> points = new ArrayList<>();
        if (raw == null || raw.trim().isEmpty()) {
            return points;
        }
        for (String pair : raw.trim().split(";")) {
            String[] xy = pair.trim().split(",");
            if (xy.length != 2) {
                log.debug("无法解析的点: '{}'", pair);
                continue;
            }
            double x = parseDouble(xy[0], Double.NaN);
            double y = parseDouble(xy[1], Double.NaN);
            if (Double.isNaN(x) || Double.isNaN(y)) {
                log.debug("无法解析的点: '{}'", pair);
                continue;
            }
            points.add(new double[]{x, y});
        }
        return points;
    }

    private static Map<String, String> readAttributes(Element shape) {
        Map<String, String> attributes = new HashMap<>();
        for (Element child : shape.children()) {
            if ("attribute".equals(child.tagName())) {
                attributes.put(child.attr("name"), child.text().trim());
            }
        }
        return attributes;
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.debug("数值解析失败: '{}'", value);
            return defaultValue;
        }
    }

    private static Integer parseInteger(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.debug("整数解析失败: '{}'", value);
            return null;
        }
    }
}
