package com.lendpool.api.controller;

import com.lendpool.pool.LendingPool;
import com.lendpool.pool.ReserveData;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /reserves, GET /reserves/{asset}. Values are projected to the time of the request.
 */
@RestController
@RequestMapping("/api/v1/reserves")
@RequiredArgsConstructor
public class ReserveController {

    private final LendingPool lendingPool;

    @GetMapping
    public ResponseEntity<List<ReserveData>> listReserves() {
        return ResponseEntity.ok(lendingPool.listedAssets().stream()
                .map(lendingPool::getReserveData)
                .toList());
    }

    @GetMapping("/{asset}")
    public ResponseEntity<ReserveData> getReserve(@PathVariable String asset) {
        return ResponseEntity.ok(lendingPool.getReserveData(asset.trim()));
    }
}
