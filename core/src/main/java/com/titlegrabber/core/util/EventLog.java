package com.titlegrabber.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * 이벤트 1건 = JSON 한 줄. 출력 대상/레벨 필터는 SLF4J 바인딩(LogSetup) 설정을 따른다.
 * kvs는 key, value 쌍의 나열.
 */
public final class EventLog {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger log;
    private final String comp;

    private EventLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls);
        this.comp = cls.getSimpleName();
    }

    public static EventLog get(Class<?> cls) {
        return new EventLog(cls);
    }

    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(toJson("DEBUG", comp, event, kvs));
    }

    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(toJson("INFO", comp, event, kvs));
    }

    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(toJson("WARN", comp, event, kvs));
    }

    static String toJson(String level, String comp, String event, Object... kvs) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", level);
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        return n.toString();
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Number num) n.put(k, num.doubleValue());
        else if (v instanceof Boolean b) n.put(k, b);
        else n.put(k, String.valueOf(v));
    }
}
