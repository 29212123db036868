package com.titlegrabber.core.permalink;

import com.titlegrabber.core.api.IPageFetcher;
import com.titlegrabber.core.model.FetchedPage;
import com.titlegrabber.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 퍼머링크 페이지(짧은 링크 랜딩 등)의 end_url을 본문이 실제로 가리키는 status 페이지들로 치환.
 *
 * 1) 컨테이너 안에서 본문/인용 블록 링크 수집 (빈 값 제거, 원문 기준 중복 제거)
 * 2) 절대 URL → 2차 페치(같은 재시도 정책)로 최종 위치 확인.
 *    퍼머링크 호스트인데 status 경로가 아니면 버림
 * 3) 상대경로 → origin 기준 해석, 해석 불가 → 버림
 * 4) 퍼머링크 호스트 + 세그먼트 2개 이상 + status 경로 아님 → 버림
 * 5) 정렬/중복 제거 후 SEPARATOR로 연결. 비면 페이지 자신의 최종 URL
 *
 * 2차 페치는 호출한 워커 스레드에서 동기로 수행된다.
 */
public class PermalinkResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PermalinkResolver.class);

    public static final String SEPARATOR = ",";

    private final PermalinkProfile profile;
    private final IPageFetcher fetcher;

    public PermalinkResolver(PermalinkProfile profile, IPageFetcher fetcher) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /** end_url 결정. 대상 페이지가 아니면 finalUrl 그대로. */
    public String resolveEndUrl(Document doc, URI finalUrl) {
        Objects.requireNonNull(finalUrl, "finalUrl");
        Element container = container(doc, finalUrl);
        if (container == null) return finalUrl.toString();

        String joined = resolve(container);
        if (joined.isEmpty()) {
            LOG.debug("No embedded permalinks on {}", finalUrl);
            return finalUrl.toString();
        }
        return joined;
    }

    /** 퍼머링크 호스트 + 컨테이너 형태일 때만 컨테이너 반환 */
    Element container(Document doc, URI finalUrl) {
        if (doc == null || !profile.isPermalinkHost(finalUrl)) return null;
        return doc.selectFirst(profile.containerSelector());
    }

    String resolve(Element container) {
        Set<URI> resolved = new LinkedHashSet<>();
        for (String candidate : candidates(container)) {
            Optional<URI> u = UrlUtils.looksAbsolute(candidate)
                    ? followAbsolute(candidate)
                    : UrlUtils.resolve(profile.origin(), candidate);
            u.ifPresent(resolved::add);
        }

        TreeSet<String> out = new TreeSet<>();
        for (URI u : resolved) {
            if (profile.isPermalinkHost(u) && UrlUtils.pathSegments(u) > 1 && !profile.isStatusPath(u)) {
                continue; // 홈/프로필 등
            }
            out.add(u.toString());
        }
        return String.join(SEPARATOR, out);
    }

    List<String> candidates(Element container) {
        Set<String> raw = new LinkedHashSet<>();
        for (Element a : container.select(profile.textLinkSelector())) {
            String v = a.attr("data-expanded-url");
            if (v.isBlank()) v = a.attr("href");
            if (!v.isBlank()) raw.add(v.trim());
        }
        for (Element a : container.select(profile.quoteLinkSelector())) {
            String v = a.attr("href");
            if (!v.isBlank()) raw.add(v.trim());
        }
        return new ArrayList<>(raw);
    }

    private Optional<URI> followAbsolute(String candidate) {
        Optional<URI> parsed = UrlUtils.parseHttp(candidate);
        if (parsed.isEmpty()) return Optional.empty();

        FetchedPage page = fetcher.fetch(parsed.get());
        if (!page.hasResponse()) {
            LOG.debug("Dropping {}: {}", candidate, page.getError());
            return Optional.empty();
        }
        URI end = page.getFinalUrl();
        if (profile.isPermalinkHost(end) && !profile.isStatusPath(end)) {
            LOG.debug("Dropping {}: resolved to non-status page {}", candidate, end);
            return Optional.empty();
        }
        return Optional.of(end);
    }
}
