package dev.konduit.crawl;

/**
 * Text harvested from one successfully fetched and parsed URL.
 *
 * @param url the fetched URL
 * @param content query-ranked readable text of the page
 */
public record Page(String url, String content) {
  public Page {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Page url must not be blank");
    }
    content = content == null ? "" : content;
  }
}
