package com.csd.leadscore.controller;

import com.csd.leadscore.model.ChatRequest;
import com.csd.leadscore.model.ChatResponse;
import com.csd.leadscore.model.LeadRecord;
import com.csd.leadscore.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        return chatService.chat(request.getQuery(), request.getLeads());
    }

    @PostMapping("/suggestions")
    public List<String> suggestions(@RequestBody(required = false) List<LeadRecord> leads) {
        return chatService.suggestions(leads);
    }
}
