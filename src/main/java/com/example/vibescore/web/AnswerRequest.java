package com.example.vibescore.web;

import com.example.vibescore.domain.ConfidenceLevel;
import com.example.vibescore.domain.QuizTrack;

public record AnswerRequest(QuizTrack track, int questionIndex, ConfidenceLevel confidence) {}
