package com.sitecrawler.scheduler.model;

/**
 * How the crawler fetches pages: plain HTML, a JS-rendering browser, or
 * automatic detection per page.
 */
public enum CrawlMode {
    HTML, JS, AUTO
}
