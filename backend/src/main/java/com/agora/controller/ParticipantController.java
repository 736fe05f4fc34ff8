package com.agora.controller;

import com.agora.model.HumanParticipant;
import com.agora.model.dto.JoinRequest;
import com.agora.model.dto.JoinResponse;
import com.agora.model.dto.SendRequest;
import com.agora.service.ParticipantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ParticipantController {

    private final ParticipantService participantService;

    @PostMapping("/join")
    public ResponseEntity<JoinResponse> join(@Valid @RequestBody JoinRequest request) {
        HumanParticipant participant = participantService.join(request.getName());
        return ResponseEntity.ok(JoinResponse.builder()
                .id(participant.getId())
                .name(participant.getName())
                .color(participant.getColor())
                .build());
    }

    @PostMapping("/send")
    public ResponseEntity<Map<String, Object>> send(@RequestBody SendRequest request) {
        participantService.send(request.getId(), request.getText(), request.getMsgId());
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
