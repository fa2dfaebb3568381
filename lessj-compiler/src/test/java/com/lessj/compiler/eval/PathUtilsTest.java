package com.lessj.compiler.eval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathUtilsTest {

    @Test
    @DisplayName("规范化消去 . 与 ..")
    void testNormalize() {
        assertEquals("a/c.less", PathUtils.normalize("a/./b/../c.less"));
        assertEquals("../x.less", PathUtils.normalize("../x.less"));
    }

    @Test
    @DisplayName("拼接目录，绝对路径与带协议的路径不变")
    void testJoin() {
        assertEquals("dir/a.less", PathUtils.join("dir/", "a.less"));
        assertEquals("dir/a.less", PathUtils.join("dir", "a.less"));
        assertEquals("/abs.less", PathUtils.join("dir/", "/abs.less"));
        assertEquals("http://x/a.css", PathUtils.join("dir/", "http://x/a.css"));
    }

    @Test
    @DisplayName("目录部分")
    void testDirname() {
        assertEquals("a/b/", PathUtils.dirname("a/b/c.less"));
        assertEquals("", PathUtils.dirname("c.less"));
    }

    @Test
    @DisplayName("目录间的相对路径")
    void testPathDiff() {
        assertEquals("../b/", PathUtils.pathDiff("a/b/", "a/c/"));
        assertEquals("sub/", PathUtils.pathDiff("sub/", ""));
    }

    @Test
    @DisplayName("rootpath 重写保留显式相对前缀")
    void testRewritePath() {
        assertEquals("./img/a.png", PathUtils.rewritePath("./a.png", "img/"));
        assertEquals("img/a.png", PathUtils.rewritePath("a.png", "img/"));
    }
}
