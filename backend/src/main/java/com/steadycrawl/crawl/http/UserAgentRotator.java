package com.steadycrawl.crawl.http;

import com.steadycrawl.config.CrawlerProperties;

import java.util.List;

public class UserAgentRotator {
    private final List<String> agents;
    private int index;

    public UserAgentRotator(List<String> agents) {
        List<String> cleaned = agents == null ? List.of() : agents.stream()
            .filter(agent -> agent != null && !agent.isBlank())
            .map(String::trim)
            .toList();
        this.agents = cleaned.isEmpty() ? List.of(CrawlerProperties.normalizeUserAgent(null)) : cleaned;
    }

    public synchronized String next() {
        String agent = agents.get(index);
        index = (index + 1) % agents.size();
        return agent;
    }
}
