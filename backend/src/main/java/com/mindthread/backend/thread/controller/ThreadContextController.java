package com.mindthread.backend.thread.controller;

import com.mindthread.backend.thread.api.FocusSnippetRequest;
import com.mindthread.backend.thread.domain.ThreadContext;
import com.mindthread.backend.thread.service.ThreadContextAssembler;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/threads")
public class ThreadContextController {

  private final ThreadContextAssembler assembler;

  public ThreadContextController(ThreadContextAssembler assembler) {
    this.assembler = assembler;
  }

  @GetMapping("/{snippetId}")
  public ThreadContext threadFor(@PathVariable("snippetId") long snippetId) {
    return assembler.build(snippetId);
  }

  @PostMapping("/focus")
  public ThreadContext threadForFocus(@Valid @RequestBody FocusSnippetRequest request) {
    return assembler.build(request.toSnippet());
  }
}
