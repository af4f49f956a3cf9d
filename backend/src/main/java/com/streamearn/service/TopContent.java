package com.streamearn.service;

import java.util.List;

public record TopContent(
        String identity,
        String tokenSymbol,
        List<ContentEarnings> content
) {
}
