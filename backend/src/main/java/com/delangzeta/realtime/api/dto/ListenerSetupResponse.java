package com.delangzeta.realtime.api.dto;

import java.util.List;

public record ListenerSetupResponse(String message, List<String> collections) {
}
