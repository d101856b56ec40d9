package dev.konduit.crawl;

/** A queued URL and its link distance from the seed. Lives only inside the BFS queue. */
record CrawlTask(String url, int depth) {}
