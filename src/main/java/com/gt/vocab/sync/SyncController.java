package com.gt.vocab.sync;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/sync")
public class SyncController {

    private final SyncService syncService;

    @Autowired
    public SyncController(SyncService syncService) {
        this.syncService = syncService;
    }

    @GetMapping(value = "/export", produces = "application/json")
    public SyncPayload exportSnapshot() {
        return syncService.exportSnapshot();
    }

    @PostMapping(value = "/import", consumes = "application/json", produces = "application/json")
    public SyncImportReport importSnapshot(@RequestBody SyncPayload payload) {
        return syncService.importSnapshot(payload);
    }
}
