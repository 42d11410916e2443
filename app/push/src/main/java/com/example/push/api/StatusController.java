/*
 * どこで: Push API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 */
package com.example.push.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "push: ok";
  }
}
