package com.example.cvatserver.util.cvat.dto;

/**
 * 坐标原点约定
 *
 * <ul>
 *   <li>TOPLEFT: 图像坐标系，原点左上角，Y轴向下递增（t &lt; b）</li>
 *   <li>BOTTOMLEFT: PDF用户空间，原点左下角，Y轴向上递增（t &gt; b）</li>
 * </ul>
 */
public enum CoordOrigin {
    TOPLEFT,
    BOTTOMLEFT
}
