package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * {@code ${date:<format>}}
 * <ul>
 *   <li>time: HH:mm:ss</li>
 *   <li>date: yyyy-MM-dd</li>
 *   <li>dateOnly: yyyyMMdd</li>
 *   <li>timestamp: epoch 秒</li>
 *   <li>iso: ISO-8601 带时区</li>
 *   <li>year: yyyy</li>
 * </ul>
 */
public class DateExtension implements PlaceholderExtension {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_ONLY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    public DateExtension(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        switch (placeholder.getPath()) {
            case "time":
                return ExtensionResult.resolved(TIME.format(now));
            case "date":
                return ExtensionResult.resolved(DATE.format(now));
            case "dateOnly":
                return ExtensionResult.resolved(DATE_ONLY.format(now));
            case "timestamp":
                return ExtensionResult.resolved(String.valueOf(now.toEpochSecond()));
            case "iso":
                return ExtensionResult.resolved(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(now));
            case "year":
                return ExtensionResult.resolved(String.valueOf(now.getYear()));
            default:
                return ExtensionResult.notFound("unknown date format " + placeholder.getPath());
        }
    }
}
