package com.example.riskscan_backend.service.modality;

import com.example.riskscan_backend.dto.TimeWindow;
import com.example.riskscan_backend.dto.Transcript;
import com.example.riskscan_backend.dto.TranscriptWord;
import com.example.riskscan_backend.dto.Utterance;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits word-timed transcripts into utterances on pauses, sentence ends and a word cap.
 */
@Component
public class TranscriptSegmenter {
    private final long pauseMs;
    private final int maxWords;

    public TranscriptSegmenter(@Value("${segmenter.pause-ms:700}") long pauseMs,
                               @Value("${segmenter.max-words:40}") int maxWords) {
        this.pauseMs = pauseMs;
        this.maxWords = Math.max(1, maxWords);
    }

    public List<Utterance> segment(Transcript transcript, long durationMs) {
        List<Utterance> out = new ArrayList<>();
        if (transcript == null) {
            return out;
        }
        List<TranscriptWord> words = transcript.words();
        if (words.isEmpty()) {
            // text without timings spans the whole clip
            String text = transcript.text() == null ? "" : transcript.text().trim();
            if (!text.isEmpty()) {
                out.add(Utterance.unscored(0, new TimeWindow(0, Math.max(1, durationMs)), text));
            }
            return out;
        }

        List<TranscriptWord> current = new ArrayList<>();
        for (TranscriptWord w : words) {
            if (!current.isEmpty()) {
                TranscriptWord last = current.get(current.size() - 1);
                boolean pause = w.startMs() - last.endMs() > pauseMs;
                if (pause || endsSentence(last.word()) || current.size() >= maxWords) {
                    out.add(toUtterance(out.size(), current));
                    current = new ArrayList<>();
                }
            }
            current.add(w);
        }
        if (!current.isEmpty()) {
            out.add(toUtterance(out.size(), current));
        }
        return out;
    }

    private static Utterance toUtterance(int index, List<TranscriptWord> words) {
        long start = words.get(0).startMs();
        long end = Math.max(start, words.get(words.size() - 1).endMs());
        StringBuilder sb = new StringBuilder();
        for (TranscriptWord w : words) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(w.word().trim());
        }
        return Utterance.unscored(index, new TimeWindow(start, end), sb.toString());
    }

    private static boolean endsSentence(String word) {
        if (word == null || word.isEmpty()) return false;
        char c = word.charAt(word.length() - 1);
        return c == '.' || c == '!' || c == '?';
    }
}
