package com.example.cvatserver.config;

import com.example.cvatserver.util.cvat.ContainmentTreeBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 阅读顺序解析参数
 *
 * 默认值硬编码，可通过 application.properties 的 cvat.reading-order.* 覆盖。
 */
@Component
public class ReadingOrderConfig {

    /** 表格跨边界判定容差（像素） */
    @Value("${cvat.reading-order.table-tolerance:2.0}")
    private double tableTolerance = 2.0;

    /** 路径点命中元素的容差（像素） */
    @Value("${cvat.reading-order.point-tolerance:1.0}")
    private double pointTolerance = 1.0;

    /** 包含树的包含比例阈值 */
    @Value("${cvat.reading-order.containment-threshold:0.95}")
    private double containmentThreshold = ContainmentTreeBuilder.DEFAULT_CONTAINMENT_THRESHOLD;

    /**
     * 非 Spring 环境下使用的默认配置
     */
    public static ReadingOrderConfig defaults() {
        return new ReadingOrderConfig();
    }

    public double getTableTolerance() {
        return tableTolerance;
    }

    public void setTableTolerance(double tableTolerance) {
        this.tableTolerance = tableTolerance;
    }

    public double getPointTolerance() {
        return pointTolerance;
    }

    public void setPointTolerance(double pointTolerance) {
        this.pointTolerance = pointTolerance;
    }

    public double getContainmentThreshold() {
        return containmentThreshold;
    }

    public void setContainmentThreshold(double containmentThreshold) {
        this.containmentThreshold = containmentThreshold;
    }
}
