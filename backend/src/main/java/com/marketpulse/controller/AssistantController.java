package com.marketpulse.controller;

import com.marketpulse.dto.assistant.ChatRequest;
import com.marketpulse.dto.assistant.ChatResponse;
import com.marketpulse.dto.assistant.InsightsResponse;
import com.marketpulse.service.assistant.AssistantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

// ========== Assistant Controller ==========
@RestController
@RequestMapping("/api/assistant")
@RequiredArgsConstructor
@Tag(name = "Assistant", description = "Questions and insights about the current dataset")
public class AssistantController {

    private final AssistantService assistantService;

    @PostMapping("/chat")
    @Operation(summary = "Ask a question about the loaded data")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        return ResponseEntity.ok(new ChatResponse(assistantService.chat(request.getMessage())));
    }

    @PostMapping("/insights")
    @Operation(summary = "Generate three business insights")
    public ResponseEntity<InsightsResponse> insights() {
        return ResponseEntity.ok(new InsightsResponse(assistantService.insights()));
    }
}
