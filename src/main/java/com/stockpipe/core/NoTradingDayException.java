package com.stockpipe.core;

import java.time.LocalDate;

/**
 * The trading calendar found no open session within its search horizon.
 */
public class NoTradingDayException extends PipelineException {
    public NoTradingDayException(LocalDate from, int horizonDays) {
        super("no_trading_day: from=" + from + " horizon_days=" + horizonDays);
    }
}
