package com.example.riskscan_backend.dto;

import com.example.riskscan_backend.util.Modality;

import java.util.List;

public record TimelineWindow(String id, TimeWindow window, List<Modality> modalities) {}
