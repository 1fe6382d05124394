package com.rememberme.backend.global.security;

import java.io.IOException;

import com.rememberme.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

final class ProblemWriter {

    private ProblemWriter() {
    }

    static void write(ObjectMapper objectMapper, HttpServletResponse response, HttpStatus status, ProblemResponse body)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
