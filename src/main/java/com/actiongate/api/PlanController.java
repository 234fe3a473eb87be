package com.actiongate.api;

import com.actiongate.plan.CompileResult;
import com.actiongate.plan.Plan;
import com.actiongate.plan.PlanCompiler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/plan")
public class PlanController {

    private final PlanCompiler planCompiler;

    public PlanController(PlanCompiler planCompiler) {
        this.planCompiler = planCompiler;
    }

    @PostMapping("/compile")
    public CompileResult compile(@RequestBody Plan plan) {
        return planCompiler.compile(plan);
    }
}
