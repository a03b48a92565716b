package com.sgw.worker.client;

public record SendReceipt(String id) {}
