package com.example.diffreview.web;

public record CommentRequest(int row, String text) {}
