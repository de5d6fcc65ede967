package com.crawlpilot.orchestrator.extract;

import com.crawlpilot.orchestrator.model.ImageInfo;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Synthetic HTML fixtures; they mimic the markup of a WeChat article page
 * without depending on a real one.
 */
class RegexMetadataExtractorTest {

    final RegexMetadataExtractor extractor = new RegexMetadataExtractor();

    @Test
    void extract_fullArticle() {
        String html = """
                <html><head><title>ignored</title></head><body>
                <h1 class="rich_media_title" id="activity-name">
                    Spring &amp; Summer
                </h1>
                <span class="rich_media_meta rich_media_meta_nickname">
                  <span class="account_nickname_inner">Tech Daily</span>
                </span>
                <em id="publish_time" class="rich_media_meta rich_media_meta_text">2024年5月1日 08:30</em>
                <div id="js_content">
                  <img data-src="https://mmbiz.qpic.cn/abc/640?wx_fmt=png&amp;from=appmsg" src="data:image/gif;base64,xx">
                  <img src="https://example.com/pics/photo.JPG?x=1">
                </div>
                </body></html>
                """;

        ArticleMetadata meta = extractor.extract(html);

        assertThat(meta.title()).isEqualTo("Spring & Summer");
        assertThat(meta.author()).isEqualTo("Tech Daily");
        assertThat(meta.publishTime()).isEqualTo("2024-05-01");
        assertThat(meta.images()).extracting(ImageInfo::originalUrl).containsExactly(
                "https://mmbiz.qpic.cn/abc/640?wx_fmt=png&from=appmsg",
                "https://example.com/pics/photo.JPG?x=1");
        assertThat(meta.images()).extracting(ImageInfo::mimeType).containsExactly("image/png", "image/jpeg");
        assertThat(meta.images().get(0).filename()).isEqualTo("image_1.png");
        assertThat(meta.wordCount()).isPositive();
    }

    @Test
    void extract_titleFallsBackToTitleTag() {
        ArticleMetadata meta = extractor.extract("<title>Only Title</title><p>x</p>");

        assertThat(meta.title()).isEqualTo("Only Title");
    }

    @Test
    void extract_nothingRecognisable_usesFallbacks() {
        ArticleMetadata meta = extractor.extract("<div>just text</div>");

        assertThat(meta.title()).isEqualTo(MetadataExtractor.UNKNOWN_TITLE);
        assertThat(meta.author()).isEqualTo(MetadataExtractor.UNKNOWN_AUTHOR);
        assertThat(meta.publishTime()).isEmpty();
        assertThat(meta.images()).isEmpty();
    }

    @Test
    void extract_platformChromeTitle_isIgnored() {
        assertThat(extractor.extract("<title>微信公众平台</title>").title())
                .isEqualTo(MetadataExtractor.UNKNOWN_TITLE);
    }

    @Test
    void extract_authorThatIsReallyADate_isIgnored() {
        ArticleMetadata meta = extractor.extract(
                "<span class=\"rich_media_meta_text\">2023-12-31</span>");

        assertThat(meta.author()).isEqualTo(MetadataExtractor.UNKNOWN_AUTHOR);
        assertThat(meta.publishTime()).isEqualTo("2023-12-31");
    }

    @Test
    void extract_isDeterministic() {
        String html = "<h1 id=\"activity-name\">Hello</h1><img src=\"https://a/b.gif\">";

        assertThat(extractor.extract(html)).isEqualTo(extractor.extract(html));
    }

    @Test
    void extract_nullOrBlank_usesFallbacks() {
        assertThat(extractor.extract(null).title()).isEqualTo(MetadataExtractor.UNKNOWN_TITLE);
        assertThat(extractor.extract("  ").wordCount()).isZero();
    }
}
