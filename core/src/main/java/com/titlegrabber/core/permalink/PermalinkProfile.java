package com.titlegrabber.core.permalink;

import com.titlegrabber.core.util.UrlUtils;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 퍼머링크 호스트 규칙(데이터).
 *
 * @param hosts             퍼머링크 호스트(소문자)
 * @param origin            상대경로 해석 기준 origin
 * @param containerSelector 퍼머링크 컨테이너(없으면 해석 안 함)
 * @param textLinkSelector  본문 링크. data-expanded-url 우선, 없으면 href
 * @param quoteLinkSelector 인용 블록 링크(href)
 * @param statusPath        status-id 경로 패턴(경로 끝 기준)
 */
public record PermalinkProfile(
        Set<String> hosts,
        URI origin,
        String containerSelector,
        String textLinkSelector,
        String quoteLinkSelector,
        Pattern statusPath
) {
    /** ".../status/<digits>"로 끝나는 경로 */
    public static final Pattern DEFAULT_STATUS_PATH = Pattern.compile("^/.+/status/\\d+$");

    public PermalinkProfile {
        Objects.requireNonNull(hosts, "hosts");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(containerSelector, "containerSelector");
        Objects.requireNonNull(textLinkSelector, "textLinkSelector");
        Objects.requireNonNull(quoteLinkSelector, "quoteLinkSelector");
        Objects.requireNonNull(statusPath, "statusPath");
        hosts = hosts.stream().map(h -> h.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        if (hosts.isEmpty()) throw new IllegalArgumentException("permalink.hosts must not be empty");
    }

    public static PermalinkProfile twitter() {
        return new PermalinkProfile(
                Set.of("twitter.com", "www.twitter.com", "mobile.twitter.com"),
                URI.create("https://twitter.com"),
                ".permalink-tweet-container",
                ".js-tweet-text-container a",
                ".QuoteTweet-container a.QuoteTweet-link, .QuoteTweet-container a[href]",
                DEFAULT_STATUS_PATH);
    }

    public boolean isPermalinkHost(URI u) {
        return hosts.contains(UrlUtils.host(u));
    }

    public boolean isStatusPath(URI u) {
        String p = (u == null ? null : u.getPath());
        return p != null && statusPath.matcher(p).matches();
    }
}
