package com.titlegrabber.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.*;

/**
 * java.util.logging 전역 설정 (SLF4J는 slf4j-jdk14로 여기에 연결됨)
 * - debug=false: 작업 디렉터리의 title_grabber.log 파일, INFO
 * - debug=true : 콘솔(stdout), FINE
 * - 파일을 열 수 없으면 콘솔로 대체
 */
public final class LogSetup {
    private LogSetup() {}

    public static final String LOG_FILE = "title_grabber.log";

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter(); // 단일 인스턴스

    public static synchronized void init(boolean debug) {
        init(debug, Paths.get(LOG_FILE));
    }

    public static synchronized void init(boolean debug, Path logFile) {
        if (initialized) return;
        initialized = true;

        Level level = debug ? Level.FINE : Level.INFO;

        // 루트 로거 초기화
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        Handler handler = null;
        if (!debug) {
            try {
                handler = new FileHandler(logFile.toString(), false);
            } catch (IOException e) {
                // 마지막 보루: 콘솔로 진행
                System.err.println("Unable to open log file " + logFile + ": " + e.getMessage());
            }
        }
        if (handler == null) handler = new StdoutHandler();

        handler.setLevel(level);
        handler.setFormatter(LINE_FORMATTER);
        root.addHandler(handler);
        root.setLevel(level);

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. debug=" + debug + ", level=" + level.getName());
    }

    /** 핸들러 제거 + 재초기화 허용(테스트용) */
    static synchronized void reset() {
        LogManager.getLogManager().reset();
        initialized = false;
    }

    /** System.out으로 내보내는 핸들러(ConsoleHandler는 stderr) */
    private static final class StdoutHandler extends StreamHandler {
        StdoutHandler() { super(System.out, LINE_FORMATTER); }
        @Override public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
        @Override public synchronized void close() { flush(); }
    }

    /** "시각 [레벨] 스레드 로거명: 메시지" 한 줄, 예외가 있으면 스택을 이어 붙임 */
    private static final class LineFormatter extends Formatter {
        private static final DateTimeFormatter TS =
                DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS", Locale.ROOT).withZone(ZoneId.systemDefault());

        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(160)
                    .append(TS.format(r.getInstant()))
                    .append(" [").append(r.getLevel().getName()).append("] ")
                    .append(Thread.currentThread().getName()).append(' ')
                    .append(shortName(r.getLoggerName())).append(": ")
                    .append(formatMessage(r))
                    .append(System.lineSeparator());

            if (r.getThrown() != null) {
                StringWriter sw = new StringWriter(512);
                r.getThrown().printStackTrace(new PrintWriter(sw));
                sb.append(sw);
            }
            return sb.toString();
        }

        private static String shortName(String logger) {
            if (logger == null) return "-";
            int dot = logger.lastIndexOf('.');
            return dot < 0 ? logger : logger.substring(dot + 1);
        }
    }
}
