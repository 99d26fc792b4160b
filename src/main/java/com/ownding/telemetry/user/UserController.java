package com.ownding.telemetry.user;

import com.ownding.telemetry.common.ApiResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Validated
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    public Mono<ApiResult<UserAccount>> createUser(@Valid @RequestBody CreateUserRequest request) {
        return Mono.fromCallable(() -> ApiResult.success("用户注册成功", userService.createUser(
                        new UserService.CreateUserCommand(request.username(), request.email(), request.tier()))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}")
    public Mono<ApiResult<UserAccount>> getUser(@PathVariable long id) {
        return Mono.fromCallable(() -> ApiResult.success(userService.getUser(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/{id}/tier")
    public Mono<ApiResult<UserAccount>> changeTier(@PathVariable long id, @Valid @RequestBody ChangeTierRequest request) {
        return Mono.fromCallable(() -> ApiResult.success("套餐已更新", userService.changeTier(id,
                        new UserService.ChangeTierCommand(request.tier(), request.subscriptionEnd(), request.capOverride()))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public record CreateUserRequest(
            @NotBlank(message = "不能为空")
            @Size(max = 64, message = "不能超过64个字符")
            String username,
            @Email(message = "邮箱格式错误") String email,
            String tier
    ) {
    }

    public record ChangeTierRequest(
            @NotBlank(message = "不能为空") String tier,
            String subscriptionEnd,
            @Min(value = 1, message = "必须大于0") Integer capOverride
    ) {
    }
}
