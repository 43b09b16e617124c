/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    @DisplayName("Keys follow prefix:segments:branch")
    void keyLayout() {
        assertThat(CacheKeys.computedFields("settlement", "s1", "main")).isEqualTo("computed-fields:settlement:s1:main");
        assertThat(CacheKeys.derivedVariable("v1", "main")).isEqualTo("derived-variable:v1:main");
        assertThat(CacheKeys.childList("structure", "settlement", "s1", "main")).isEqualTo("structures:settlement:s1:main");
        assertThat(CacheKeys.build("custom", "b2", "a", null, "", "c")).isEqualTo("custom:a:c:b2");
    }

    @Test
    @DisplayName("Patterns target one type or one branch")
    void patterns() {
        assertThat(CacheKeys.computedFieldsPattern("settlement", "main")).isEqualTo("computed-fields:settlement:*:main");
        assertThat(CacheKeys.entityPattern("settlement", "s1", "main")).isEqualTo("*:settlement:s1:main");
        assertThat(CacheKeys.branchPattern("feature")).isEqualTo("*:feature");
        assertThat(CacheKeys.prefixPattern("derived-variable")).isEqualTo("derived-variable:*");
    }

    @Test
    @DisplayName("Parse splits a key into prefix, segments and branch")
    void parse() {
        CacheKeys.ParsedKey parsed = CacheKeys.parse("computed-fields:settlement:s1:main").orElseThrow();

        assertThat(parsed.prefix()).isEqualTo("computed-fields");
        assertThat(parsed.segments()).isEqualTo(List.of("settlement", "s1"));
        assertThat(parsed.branchId()).isEqualTo("main");

        assertThat(CacheKeys.parse("no-separator")).isEmpty();
        assertThat(CacheKeys.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("Glob translation matches like Redis KEYS")
    void globToRegex() {
        Pattern typeWide = Pattern.compile(CacheKeys.globToRegex(CacheKeys.computedFieldsPattern("settlement", "main")));
        assertThat(typeWide.matcher("computed-fields:settlement:s1:main").matches()).isTrue();
        assertThat(typeWide.matcher("computed-fields:settlement:s2:main").matches()).isTrue();
        assertThat(typeWide.matcher("computed-fields:structure:s1:main").matches()).isFalse();
        assertThat(typeWide.matcher("computed-fields:settlement:s1:feature").matches()).isFalse();

        Pattern single = Pattern.compile(CacheKeys.globToRegex("k?y.[ab]"));
        assertThat(single.matcher("key.a").matches()).isTrue();
        assertThat(single.matcher("kxy.b").matches()).isTrue();
        assertThat(single.matcher("key-a").matches()).isFalse();

        Pattern escaped = Pattern.compile(CacheKeys.globToRegex("a\\*b"));
        assertThat(escaped.matcher("a*b").matches()).isTrue();
        assertThat(escaped.matcher("axxb").matches()).isFalse();
    }
}
