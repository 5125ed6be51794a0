package com.example.diffreview.web;

public record SendRequest(String command) {}
