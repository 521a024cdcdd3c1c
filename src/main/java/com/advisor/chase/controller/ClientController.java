package com.advisor.chase.controller;

import com.advisor.chase.model.Client;
import com.advisor.chase.repository.ClientRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/clients")
@Tag(name = "Clients", description = "Client contact directory used by the document chaser")
public class ClientController {

    private final ClientRepository clientRepository;

    public ClientController(ClientRepository clientRepository) {
        this.clientRepository = clientRepository;
    }

    @Operation(summary = "Get a client")
    @GetMapping("/{clientId}")
    public ResponseEntity<Client> getClient(
            @Parameter(description = "Client ID", example = "CLIENT-001")
            @PathVariable String clientId) {
        Client client = clientRepository.findByClientId(clientId);
        if (client == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(client);
    }

    @Operation(summary = "Create or replace a client",
            description = "At least one of email or phone is required so documents can be chased.")
    @PutMapping("/{clientId}")
    public ResponseEntity<?> putClient(@PathVariable String clientId, @RequestBody Client client) {
        client.setClientId(clientId);
        if (client.getName() == null || client.getName().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "name is required"));
        }
        if (!client.hasAnyContact()) {
            return ResponseEntity.badRequest().body(Map.of("error", "email or phone is required"));
        }
        clientRepository.save(client);
        return ResponseEntity.ok(client);
    }
}
