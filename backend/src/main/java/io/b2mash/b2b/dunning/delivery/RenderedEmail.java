package io.b2mash.b2b.dunning.delivery;

public record RenderedEmail(String subject, String htmlBody, String plainTextBody) {}
