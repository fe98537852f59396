package com.yerin.bgworker.application;

public record EmailWelcomeArgs(long userId, String email) {
}
