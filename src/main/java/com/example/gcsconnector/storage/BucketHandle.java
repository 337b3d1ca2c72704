package com.example.gcsconnector.storage;

public record BucketHandle(String name) {
}
