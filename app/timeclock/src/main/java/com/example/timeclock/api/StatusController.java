/*
 * どこで: Timeclock API
 * 何を: ルートで簡易ヘルス応答を返す
 * なぜ: キオスクのシェルから死活を素早く確認するため
 */
package com.example.timeclock.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "timeclock: ok";
  }
}
