package com.stockpipe.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsRow {
    private String url;
    private String tickerFetchedFor;
    private String title;
    private String source;
    private OffsetDateTime publishedAt;
    private String summary;
    private OffsetDateTime collectedAt;
}
