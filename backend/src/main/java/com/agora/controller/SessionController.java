package com.agora.controller;

import com.agora.engine.PersonaCatalog;
import com.agora.model.Persona;
import com.agora.model.dto.SessionSnapshot;
import com.agora.service.SessionViewService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SessionController {

    private final SessionViewService sessionViewService;
    private final PersonaCatalog personaCatalog;

    @GetMapping("/state")
    public ResponseEntity<SessionSnapshot> state() {
        return ResponseEntity.ok(sessionViewService.snapshot());
    }

    @GetMapping("/personas")
    public ResponseEntity<List<Persona>> personas() {
        return ResponseEntity.ok(personaCatalog.all());
    }
}
