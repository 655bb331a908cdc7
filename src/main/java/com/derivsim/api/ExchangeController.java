package com.derivsim.api;

import com.derivsim.core.command.Command;
import com.derivsim.core.command.CommandResult;
import com.derivsim.core.command.GetState;
import com.derivsim.disruptor.CommandEventProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api")
@Slf4j
public class ExchangeController {

    private final CommandEventProducer producer;
    private final long timeoutMs;

    public ExchangeController(CommandEventProducer producer,
                              @Value("${app.command-timeout-ms:5000}") long timeoutMs) {
        this.producer = producer;
        this.timeoutMs = timeoutMs;
    }

    @PostMapping("/command")
    public ResponseEntity<CommandResult> execute(@RequestBody Command command) {
        return dispatch(command);
    }

    @GetMapping("/state")
    public ResponseEntity<CommandResult> state() {
        return dispatch(new GetState());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CommandResult> unreadable(HttpMessageNotReadableException e) {
        String reason = e.getMostSpecificCause().getMessage();
        log.warn("Rejected undecodable command: {}", reason);
        return ResponseEntity.badRequest().body(CommandResult.fail("unknown", "invalid command: " + reason, null));
    }

    private ResponseEntity<CommandResult> dispatch(Command command) {
        if (command == null) {
            return ResponseEntity.badRequest().body(CommandResult.fail("unknown", "empty command", null));
        }
        CompletableFuture<CommandResult> future = producer.publish(command);
        try {
            CommandResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
        } catch (TimeoutException e) {
            // the command stays queued and will still be applied
            log.warn("No response for {} within {} ms", command.commandName(), timeoutMs);
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(CommandResult.fail(command.commandName(), "no response yet", null));
        } catch (ExecutionException e) {
            log.error("Command {} failed", command.commandName(), e.getCause());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(CommandResult.fail(command.commandName(), e.getCause().getMessage(), null));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(CommandResult.fail(command.commandName(), "interrupted", null));
        }
    }
}
