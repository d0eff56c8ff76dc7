package com.company.placeholder.time;

import com.company.placeholder.domain.enums.CronFieldType;
import lombok.Value;

/**
 * The five fields of a UNIX cron expression, each classified by shape.
 */
@Value
public class CronSchedule {
    String expression;
    String minute;
    String hour;
    String dayOfMonth;
    String month;
    String dayOfWeek;

    public CronFieldType minuteType() {
        return CronFieldType.classify(minute);
    }

    public CronFieldType hourType() {
        return CronFieldType.classify(hour);
    }

    public CronFieldType dayOfMonthType() {
        return CronFieldType.classify(dayOfMonth);
    }

    public CronFieldType monthType() {
        return CronFieldType.classify(month);
    }

    public CronFieldType dayOfWeekType() {
        return CronFieldType.classify(dayOfWeek);
    }
}
