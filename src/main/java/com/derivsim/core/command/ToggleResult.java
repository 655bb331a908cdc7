package com.derivsim.core.command;

public record ToggleResult(String flag, boolean enabled) {
}
