package com.stockpipe.data;

import lombok.Builder;
import lombok.Value;

/**
 * Provider news item before cleaning. {@code publishedRaw} is whatever the provider sent:
 * epoch seconds, epoch millis or an ISO string.
 */
@Value
@Builder
public class RawArticle {
    String url;
    String headline;
    String source;
    String summary;
    Object publishedRaw;
}
