package com.rescuegrid.incident.service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/** 공개 사건 코드 생성기: {@code INC-yyyyMMdd-XXXXXX} (접수일 UTC + 랜덤 16진수 6자리) */
public final class IncidentCodes {

    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private IncidentCodes() {
    }

    public static String next() {
        return next(LocalDate.now(ZoneOffset.UTC));
    }

    static String next(LocalDate date) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6).toUpperCase(Locale.ROOT);
        return "INC-" + date.format(DATE) + "-" + suffix;
    }
}
