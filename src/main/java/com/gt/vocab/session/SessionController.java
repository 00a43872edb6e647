package com.gt.vocab.session;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

@RestController
@RequestMapping("/rest/session")
public class SessionController {

    private final SessionComposer sessionComposer;
    private final int defaultLimit;

    @Autowired
    public SessionController(SessionComposer sessionComposer,
                             @Value("${vocab.session.defaultLimit:30}") int defaultLimit) {
        this.sessionComposer = sessionComposer;
        this.defaultLimit = defaultLimit;
    }

    @GetMapping(value = "/today", produces = "application/json")
    public Session getTodaySession(@RequestParam(value = "limit") Optional<Integer> limit) {
        return sessionComposer.composeSession(limit.orElse(defaultLimit));
    }
}
