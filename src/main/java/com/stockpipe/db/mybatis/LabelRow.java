package com.stockpipe.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabelRow {
    private String ticker;
    private LocalDate date;
    private Integer labelBinary;
    private Double pctReturn;
    private Double closeT;
    private Double closeNext;
}
