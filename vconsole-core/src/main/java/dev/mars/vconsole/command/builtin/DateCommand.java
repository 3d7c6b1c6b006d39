/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.vconsole.command.builtin;

import dev.mars.vconsole.command.BaseCommand;
import dev.mars.vconsole.command.CommandContext;
import dev.mars.vconsole.command.ExitCode;
import io.vertx.core.Future;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * {@code date [-uRI] [+FORMAT]}: prints the current time. {@code +FORMAT}
 * understands {@code %Y %m %d %H %M %S %s %N %a %b %Z %%}.
 */
public final class DateCommand extends BaseCommand {

    private static final DateTimeFormatter DEFAULT =
            DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss zzz yyyy", Locale.ENGLISH);

    private final Clock clock;

    public DateCommand() {
        this(Clock.systemDefaultZone());
    }

    public DateCommand(Clock clock) {
        super("date", "Print the current date and time", "date [-uRI] [+FORMAT]");
        this.clock = clock;
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        if (args.has("u", "utc")) {
            now = now.withZoneSameInstant(ZoneOffset.UTC);
        }
        String format = args.positional().stream()
                .filter(arg -> arg.startsWith("+"))
                .findFirst()
                .map(arg -> arg.substring(1))
                .orElse(null);

        String output;
        if (args.has("R", "rfc-2822")) {
            output = DateTimeFormatter.RFC_1123_DATE_TIME.format(now);
        } else if (args.has("I", "iso-8601")) {
            output = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(now.withNano(0));
        } else if (format != null) {
            output = formatCustom(now, format);
        } else {
            output = DEFAULT.format(now);
        }
        context.out(output + "\n");
        return Future.succeededFuture(ExitCode.SUCCESS);
    }

    static String formatCustom(ZonedDateTime time, String format) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c != '%' || i + 1 >= format.length()) {
                out.append(c);
                continue;
            }
            char conversion = format.charAt(++i);
            switch (conversion) {
                case 'Y' -> out.append(time.getYear());
                case 'm' -> out.append(String.format("%02d", time.getMonthValue()));
                case 'd' -> out.append(String.format("%02d", time.getDayOfMonth()));
                case 'H' -> out.append(String.format("%02d", time.getHour()));
                case 'M' -> out.append(String.format("%02d", time.getMinute()));
                case 'S' -> out.append(String.format("%02d", time.getSecond()));
                case 's' -> out.append(time.toEpochSecond());
                case 'N' -> out.append(String.format("%09d", time.getNano()));
                case 'a' -> out.append(DateTimeFormatter.ofPattern("EEE", Locale.ENGLISH).format(time));
                case 'b' -> out.append(DateTimeFormatter.ofPattern("MMM", Locale.ENGLISH).format(time));
                case 'Z' -> out.append(DateTimeFormatter.ofPattern("zzz", Locale.ENGLISH).format(time));
                case '%' -> out.append('%');
                default -> out.append('%').append(conversion);
            }
        }
        return out.toString();
    }
}
