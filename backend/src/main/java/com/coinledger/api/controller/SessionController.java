package com.coinledger.api.controller;

import com.coinledger.domain.Lot;
import com.coinledger.domain.RealizedGain;
import com.coinledger.session.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Session audit lists and deletion.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;

    @GetMapping("/{id}/realized-gains")
    public List<RealizedGain> realizedGains(@PathVariable String id) {
        return sessionService.get(id).realizedGains();
    }

    @GetMapping("/{id}/lots")
    public List<Lot> lots(@PathVariable String id) {
        return sessionService.get(id).lots();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        sessionService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
