package com.shopmate.backend.modules.chat.presentation;

import com.shopmate.backend.modules.chat.application.ChatCommandService;
import com.shopmate.backend.modules.chat.presentation.dto.ChatEventRequest;
import com.shopmate.backend.modules.chat.presentation.dto.ChatReplyResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/chat")
public class ChatController {

    private final ChatCommandService chatCommandService;

    public ChatController(ChatCommandService chatCommandService) {
        this.chatCommandService = chatCommandService;
    }

    @Operation(summary = "Handle a chat message", description = "Runs the command in the message and returns the reply for its conversation.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Handled; replied is false when the message needs no answer"),
            @ApiResponse(responseCode = "422", description = "Malformed event")
    })
    @PostMapping("/events")
    public ResponseEntity<ChatReplyResponse> handleEvent(@Valid @RequestBody ChatEventRequest request) {
        if (request.fromBot()) {
            return ResponseEntity.ok(ChatReplyResponse.none());
        }
        ChatReplyResponse response = chatCommandService.handle(request.toEvent())
                .map(text -> new ChatReplyResponse(true, request.channel(), text))
                .orElseGet(ChatReplyResponse::none);
        return ResponseEntity.ok(response);
    }
}
