package com.purchasingpower.cora.util;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

public final class ContentHashing {

    private ContentHashing() {
    }

    public static String sha256(String content) {
        return Hashing.sha256().hashString(content, StandardCharsets.UTF_8).toString();
    }
}
