package com.crawlpilot.orchestrator.extract;

import com.crawlpilot.orchestrator.model.ImageInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction from WeChat article markup.
 *
 * Each fact is tried against an ordered list of patterns; the first
 * non-blank match wins. Page-structure drift only degrades the result to
 * the fallback values, it never throws.
 */
@Component
public class RegexMetadataExtractor implements MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(RegexMetadataExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final List<Pattern> TITLE_PATTERNS = List.of(
            Pattern.compile("<h1[^>]*id=\"activity-name\"[^>]*>(.*?)</h1>", FLAGS),
            Pattern.compile("<h1[^>]*class=\"[^\"]*rich_media_title[^\"]*\"[^>]*>(.*?)</h1>", FLAGS),
            Pattern.compile("<title[^>]*>([^<]+)</title>", FLAGS));

    private static final List<Pattern> AUTHOR_PATTERNS = List.of(
            Pattern.compile("<span[^>]*class=\"[^\"]*account_nickname_inner[^\"]*\"[^>]*>(.*?)</span>", FLAGS),
            Pattern.compile("<span[^>]*class=\"[^\"]*rich_media_meta_text[^\"]*\"[^>]*>(.*?)</span>", FLAGS));

    private static final Pattern PUBLISH_TIME_TAG =
            Pattern.compile("<[a-z]+[^>]*id=\"publish_time\"[^>]*>([^<]*)<", FLAGS);
    private static final Pattern ISO_DATE =
            Pattern.compile("(\\d{4})[-年](\\d{1,2})[-月](\\d{1,2})");

    private static final Pattern IMG_TAG  = Pattern.compile("<img\\b[^>]*>", FLAGS);
    private static final Pattern DATA_SRC = Pattern.compile("\\bdata-src=\"([^\"]+)\"", FLAGS);
    private static final Pattern SRC      = Pattern.compile("\\bsrc=\"([^\"]+)\"", FLAGS);
    private static final Pattern WX_FMT   = Pattern.compile("[?&]wx_fmt=([a-z0-9]+)", FLAGS);
    private static final Pattern TAG      = Pattern.compile("<[^>]*>");

    // Page-chrome titles that say nothing about the article.
    private static final String PLATFORM_TITLE = "微信公众平台";

    @Override
    public ArticleMetadata extract(String html) {
        if (html == null || html.isBlank()) {
            return new ArticleMetadata(UNKNOWN_TITLE, UNKNOWN_AUTHOR, "", List.of(), 0);
        }
        String title  = firstMatch(TITLE_PATTERNS, html);
        String author = firstMatch(AUTHOR_PATTERNS, html);
        if (author != null && ISO_DATE.matcher(author).find()) {
            author = null;
        }
        if (title == null || title.contains(PLATFORM_TITLE)) {
            log.debug("No usable title found");
            title = UNKNOWN_TITLE;
        }
        return new ArticleMetadata(
                title,
                author != null ? author : UNKNOWN_AUTHOR,
                publishTime(html),
                images(html),
                cleanText(html).length());
    }

    // ------------------------------------------------------------------
    // Individual facts
    // ------------------------------------------------------------------

    private static String firstMatch(List<Pattern> patterns, String html) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(html);
            if (m.find()) {
                String text = cleanText(m.group(1));
                if (!text.isEmpty()) return text;
            }
        }
        return null;
    }

    static String publishTime(String html) {
        Matcher tag = PUBLISH_TIME_TAG.matcher(html);
        if (tag.find()) {
            String normalized = normalizeDate(tag.group(1));
            if (normalized != null) return normalized;
        }
        String normalized = normalizeDate(html);
        return normalized != null ? normalized : "";
    }

    private static String normalizeDate(String text) {
        Matcher m = ISO_DATE.matcher(text);
        if (!m.find()) return null;
        return String.format("%s-%02d-%02d", m.group(1),
                Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    }

    static List<ImageInfo> images(String html) {
        Set<String> seen = new LinkedHashSet<>();
        Matcher tags = IMG_TAG.matcher(html);
        while (tags.find()) {
            String tag = tags.group();
            Matcher src = DATA_SRC.matcher(tag);
            if (!src.find()) {
                src = SRC.matcher(tag);
                if (!src.find()) continue;
            }
            String url = src.group(1).replace("&amp;", "&");
            if (url.startsWith("http")) {
                seen.add(url);
            }
        }
        List<ImageInfo> images = new ArrayList<>(seen.size());
        int index = 1;
        for (String url : seen) {
            String ext = extension(url);
            images.add(ImageInfo.remote(url, "image_" + index++ + "." + ext, "image/" + mimeSubtype(ext)));
        }
        return images;
    }

    private static String extension(String url) {
        Matcher fmt = WX_FMT.matcher(url);
        if (fmt.find()) return fmt.group(1).toLowerCase(Locale.ROOT);
        String path = url.split("[?#]", 2)[0];
        int slash = path.lastIndexOf('/');
        int dot   = path.lastIndexOf('.');
        if (dot > slash && dot < path.length() - 1) {
            String ext = path.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (ext.matches("[a-z0-9]{2,5}")) return ext;
        }
        return "jpg";
    }

    private static String mimeSubtype(String ext) {
        return switch (ext) {
            case "jpg", "jpeg" -> "jpeg";
            case "svg"         -> "svg+xml";
            default            -> ext;
        };
    }

    private static String cleanText(String fragment) {
        return TAG.matcher(fragment).replaceAll(" ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
