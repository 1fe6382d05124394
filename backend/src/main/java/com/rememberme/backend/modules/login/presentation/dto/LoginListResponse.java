package com.rememberme.backend.modules.login.presentation.dto;

import java.util.List;

public record LoginListResponse(String username, List<LoginSummaryResponse> items) {
}
