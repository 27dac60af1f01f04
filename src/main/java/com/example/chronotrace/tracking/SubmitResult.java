package com.example.chronotrace.tracking;

import lombok.Value;

@Value
public class SubmitResult {
    String streamId;
    int accepted;
    int rejectedLate;
    int pending;
    int openTracks;
}
