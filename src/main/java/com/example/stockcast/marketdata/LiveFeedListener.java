package com.example.stockcast.marketdata;

import com.example.stockcast.domain.LiveTick;

public interface LiveFeedListener {

    void onTick(LiveTick tick);

    // Transport failure of this subscription; delivery may resume afterwards
    void onError(LiveFeedException error);
}
