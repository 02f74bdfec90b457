package com.orderstream.ordering.infrastructure.web;

import com.orderstream.security.CallerContext;
import com.orderstream.security.RoleHeaderParser;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies a {@link CallerContext} parameter from the {@code X-User-Id} and {@code X-User-Roles}
 * headers set by the upstream session layer. Missing headers give an anonymous caller.
 */
public class CallerContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerContext.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                         NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return RoleHeaderParser.toCallerContext(
                webRequest.getHeader(RoleHeaderParser.USER_ID_HEADER),
                webRequest.getHeader(RoleHeaderParser.ROLES_HEADER));
    }
}
