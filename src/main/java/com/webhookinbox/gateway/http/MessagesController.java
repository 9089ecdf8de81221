package com.webhookinbox.gateway.http;

import com.webhookinbox.query.QueryService;
import com.webhookinbox.shared.model.MessageStats;
import com.webhookinbox.shared.model.MessagesResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MessagesController {

    private final QueryService queryService;

    public MessagesController(QueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/messages")
    public MessagesResponse messages(
            @RequestParam(name = "limit", defaultValue = "50") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "from", required = false) String from,
            @RequestParam(name = "since", required = false) String since,
            @RequestParam(name = "q", required = false) String q) {
        return queryService.messages(limit, offset, from, since, q);
    }

    @GetMapping("/stats")
    public MessageStats stats() {
        return queryService.stats();
    }
}
