package com.delangzeta.realtime.api.dto;

import java.util.List;

public record ListenerSetupRequest(List<String> collections) {
}
