package com.example.gcsconnector.storage;

public record BlobHandle(BucketHandle bucket, String key) {

    @Override
    public String toString() {
        return "gs://" + bucket.name() + "/" + key;
    }
}
