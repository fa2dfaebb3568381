package com.lessj.compiler.parser;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Comment;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Import;
import com.lessj.compiler.ast.rule.MixinDefinition;
import com.lessj.compiler.ast.rule.Ruleset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Ruleset parse(String source) {
        return new Parser(Parser.preprocess(source), FileInfo.entry("test.less", "", "")).parse();
    }

    private List<Node> rules(String source) {
        return parse(source).getRules();
    }

    @Nested
    @DisplayName("预处理")
    class PreprocessTests {

        @Test
        @DisplayName("去掉 BOM 并统一换行")
        void testPreprocess() {
            assertEquals("a\nb\nc", Parser.preprocess("﻿a\r\nb\rc"));
        }
    }

    @Nested
    @DisplayName("顶层规则")
    class TopLevelTests {

        @Test
        @DisplayName("根规则集标记为 root 与 firstRoot")
        void testRootFlags() {
            Ruleset root = parse("a { b: c; }");
            assertTrue(root.isRoot());
            assertTrue(root.isFirstRoot());
        }

        @Test
        @DisplayName("变量声明")
        void testVariableDeclaration() {
            List<Node> rules = rules("@size: 10px;");
            assertEquals(1, rules.size());
            Declaration decl = assertInstanceOf(Declaration.class, rules.get(0));
            assertEquals("@size", decl.getName());
            assertTrue(decl.isVariable());
        }

        @Test
        @DisplayName("带参数的规则解析为 mixin 定义")
        void testMixinDefinition() {
            MixinDefinition mixin = assertInstanceOf(MixinDefinition.class,
                    rules(".m(@a; @b: 2) { x: @a; }").get(0));
            assertEquals(".m", mixin.getName());
            assertEquals(2, mixin.getParams().size());
        }

        @Test
        @DisplayName("规则集与嵌套声明")
        void testRuleset() {
            Ruleset ruleset = assertInstanceOf(Ruleset.class, rules(".a, .b { color: red; .c { x: y; } }").get(0));
            assertEquals(2, ruleset.getSelectors().size());
            assertEquals(2, ruleset.getRules().size());
            assertInstanceOf(Declaration.class, ruleset.getRules().get(0));
            assertInstanceOf(Ruleset.class, ruleset.getRules().get(1));
        }

        @Test
        @DisplayName("@import 与选项")
        void testImport() {
            Import imp = assertInstanceOf(Import.class, rules("@import (reference) 'lib';").get(0));
            assertTrue(imp.getOptions().isReference());
            assertEquals("lib", imp.getPathValue());
        }

        @Test
        @DisplayName("块注释保留，行注释丢弃")
        void testComments() {
            List<Node> rules = rules("/* keep */\n// drop\na { b: c; }");
            assertInstanceOf(Comment.class, rules.get(0));
            assertInstanceOf(Ruleset.class, rules.get(rules.size() - 1));
        }

        @Test
        @DisplayName("合并标记")
        void testMergeFlag() {
            Ruleset ruleset = (Ruleset) rules("a { b+: c; d+_: e; }").get(0);
            assertEquals("+", ((Declaration) ruleset.getRules().get(0)).getMerge());
            assertEquals("+_", ((Declaration) ruleset.getRules().get(1)).getMerge());
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少右花括号时定位到左花括号")
        void testUnclosedBrace() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a { b: c;"));
            assertEquals(ErrorKind.PARSE, e.getKind());
            assertEquals("missing closing `}`", e.getRawMessage());
            assertEquals(2, e.getIndex());
            assertEquals("test.less", e.getFilename());
        }

        @Test
        @DisplayName("缺少右括号")
        void testUnclosedParen() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a { b: c(; }"));
            assertEquals("missing closing `)`", e.getRawMessage());
        }

        @Test
        @DisplayName("无法识别的输入")
        void testUnrecognisedInput() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a { b: c; } }"));
            assertEquals(ErrorKind.PARSE, e.getKind());
        }
    }
}
